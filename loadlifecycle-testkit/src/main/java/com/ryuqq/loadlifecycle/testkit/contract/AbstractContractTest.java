package com.ryuqq.loadlifecycle.testkit.contract;

import com.ryuqq.loadlifecycle.adapter.inmemory.broadcast.InMemoryBroadcastHub;
import com.ryuqq.loadlifecycle.adapter.inmemory.external.InMemoryApprovalService;
import com.ryuqq.loadlifecycle.adapter.inmemory.external.InMemoryFinancialLedger;
import com.ryuqq.loadlifecycle.adapter.inmemory.external.InMemoryHoursOfServiceService;
import com.ryuqq.loadlifecycle.adapter.inmemory.external.InMemoryOutboundGateway;
import com.ryuqq.loadlifecycle.adapter.inmemory.store.InMemoryConvoyStore;
import com.ryuqq.loadlifecycle.adapter.inmemory.store.InMemoryLoadStore;
import com.ryuqq.loadlifecycle.adapter.runner.convoy.ConvoySyncService;
import com.ryuqq.loadlifecycle.adapter.runner.convoy.ConvoySyncTimeoutSweeper;
import com.ryuqq.loadlifecycle.adapter.runner.convoy.SeparationMonitor;
import com.ryuqq.loadlifecycle.adapter.runner.effect.AsyncEffectDispatcher;
import com.ryuqq.loadlifecycle.adapter.runner.effect.BroadcastEffectHandler;
import com.ryuqq.loadlifecycle.adapter.runner.effect.EffectDispatchConfig;
import com.ryuqq.loadlifecycle.adapter.runner.effect.FinancialEffectHandler;
import com.ryuqq.loadlifecycle.adapter.runner.effect.NotificationEffectHandler;
import com.ryuqq.loadlifecycle.adapter.runner.effect.OutboundEffectHandler;
import com.ryuqq.loadlifecycle.adapter.runner.engine.EngineConfig;
import com.ryuqq.loadlifecycle.adapter.runner.engine.TransitionEngine;
import com.ryuqq.loadlifecycle.adapter.runner.guard.GeofenceConfig;
import com.ryuqq.loadlifecycle.adapter.runner.guard.StandardGuards;
import com.ryuqq.loadlifecycle.adapter.runner.sweep.AutoTransitionSweeper;
import com.ryuqq.loadlifecycle.adapter.runner.sweep.ScheduledSweepRunner;
import com.ryuqq.loadlifecycle.adapter.runner.sweep.SweeperConfig;
import com.ryuqq.loadlifecycle.core.catalog.TransitionCatalog;
import com.ryuqq.loadlifecycle.core.convoy.Convoy;
import com.ryuqq.loadlifecycle.core.convoy.SeparationConfig;
import com.ryuqq.loadlifecycle.core.model.Actor;
import com.ryuqq.loadlifecycle.core.model.ActorRole;
import com.ryuqq.loadlifecycle.core.model.ConvoyId;
import com.ryuqq.loadlifecycle.core.model.GeoPoint;
import com.ryuqq.loadlifecycle.core.model.Load;
import com.ryuqq.loadlifecycle.core.model.LoadDocument;
import com.ryuqq.loadlifecycle.core.model.LoadId;
import com.ryuqq.loadlifecycle.core.model.TransitionContext;
import com.ryuqq.loadlifecycle.core.outcome.Committed;
import com.ryuqq.loadlifecycle.core.outcome.Rejected;
import com.ryuqq.loadlifecycle.core.outcome.TransitionOutcome;
import com.ryuqq.loadlifecycle.core.statemachine.EscortState;
import com.ryuqq.loadlifecycle.core.statemachine.LoadState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for Load Lifecycle Contract Tests.
 *
 * <p>Wires the complete in-memory stack the same way a deployment would, so that
 * contract tests exercise real transitions, effects, convoy synchronization and sweeps
 * together rather than one component at a time.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>MutableClock: shared clock, moved explicitly by tests</li>
 *   <li>InMemoryLoadStore / InMemoryConvoyStore: persistence with version checks</li>
 *   <li>InMemoryBroadcastHub: channel and user delivery history</li>
 *   <li>InMemoryFinancialLedger / InMemoryOutboundGateway: effect sinks</li>
 *   <li>TransitionEngine with ConvoySyncService registered as state listener</li>
 *   <li>AutoTransitionSweeper and ConvoySyncTimeoutSweeper behind a ScheduledSweepRunner</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         LoadId loadId = seedPublishableDraft("LOAD-001");
 *         driveTo(loadId, LoadState.IN_TRANSIT);
 *
 *         assertLoadState(loadId, LoadState.IN_TRANSIT);
 *     }
 * }
 * </pre>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected static final Instant START = Instant.parse("2026-03-02T08:00:00Z");
    protected static final GeoPoint PICKUP = GeoPoint.of(32.7767, -96.7970);
    protected static final GeoPoint DELIVERY = GeoPoint.of(29.7604, -95.3698);
    protected static final BigDecimal RATE = new BigDecimal("2450.00");

    protected static final Actor SHIPPER = Actor.of("shipper-1", ActorRole.SHIPPER);
    protected static final Actor CARRIER = Actor.of("carrier-1", ActorRole.CATALYST);
    protected static final Actor DRIVER = Actor.of("driver-1", ActorRole.DRIVER);
    protected static final Actor DISPATCHER = Actor.of("dispatch-1", ActorRole.DISPATCH);
    protected static final Actor FACTOR = Actor.of("factoring-1", ActorRole.FACTORING);
    protected static final Actor LEAD_ESCORT = Actor.of("escort-lead", ActorRole.ESCORT);

    private static final Duration EFFECT_IDLE_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Happy path from DRAFT to COMPLETE, with the context each guard needs.
     */
    private static final List<Step> HAPPY_PATH = List.of(
        new Step(LoadState.POSTED, "DRAFT_TO_POSTED", SHIPPER, TransitionContext.empty()),
        new Step(LoadState.AWARDED, "POSTED_TO_AWARDED", SHIPPER,
            TransitionContext.builder().assign(ActorRole.CATALYST, CARRIER.actorId()).build()),
        new Step(LoadState.ACCEPTED, "AWARDED_TO_ACCEPTED", CARRIER, TransitionContext.empty()),
        new Step(LoadState.ASSIGNED, "ACCEPTED_TO_ASSIGNED", CARRIER,
            TransitionContext.builder().assign(ActorRole.DRIVER, DRIVER.actorId()).build()),
        new Step(LoadState.CONFIRMED, "ASSIGNED_TO_CONFIRMED", DRIVER, TransitionContext.empty()),
        new Step(LoadState.EN_ROUTE_PICKUP, "CONFIRMED_TO_EN_ROUTE_PICKUP", DRIVER,
            TransitionContext.builder().document(LoadDocument.PRE_TRIP_INSPECTION).build()),
        new Step(LoadState.AT_PICKUP, "EN_ROUTE_TO_AT_PICKUP", DRIVER,
            TransitionContext.builder().location(PICKUP).build()),
        new Step(LoadState.PICKUP_CHECKIN, "AT_PICKUP_TO_CHECKIN", DRIVER,
            TransitionContext.builder().location(PICKUP).build()),
        new Step(LoadState.LOADING, "CHECKIN_TO_LOADING", DRIVER, TransitionContext.empty()),
        new Step(LoadState.LOADED, "LOADING_TO_LOADED", DRIVER, TransitionContext.builder()
            .document(LoadDocument.WEIGHT_TICKET)
            .document(LoadDocument.SEAL_NUMBERS)
            .build()),
        new Step(LoadState.IN_TRANSIT, "LOADED_TO_IN_TRANSIT", DRIVER,
            TransitionContext.builder().document(LoadDocument.BOL_SIGNED).build()),
        new Step(LoadState.AT_DELIVERY, "IN_TRANSIT_TO_AT_DELIVERY", DRIVER,
            TransitionContext.builder().location(DELIVERY).build()),
        new Step(LoadState.DELIVERY_CHECKIN, "AT_DELIVERY_TO_CHECKIN", DRIVER,
            TransitionContext.builder().location(DELIVERY).build()),
        new Step(LoadState.UNLOADING, "DELIVERY_CHECKIN_TO_UNLOADING", DRIVER, TransitionContext.empty()),
        new Step(LoadState.UNLOADED, "UNLOADING_TO_UNLOADED", DRIVER, TransitionContext.empty()),
        new Step(LoadState.POD_PENDING, "UNLOADED_TO_POD_PENDING", DRIVER, TransitionContext.builder()
            .document(LoadDocument.POD_PHOTO)
            .document(LoadDocument.POD_SIGNATURE)
            .build()),
        new Step(LoadState.DELIVERED, "POD_TO_DELIVERED", SHIPPER, TransitionContext.empty()),
        new Step(LoadState.INVOICED, "DELIVERED_TO_INVOICED", Actor.system(), TransitionContext.empty()),
        new Step(LoadState.PAID, "INVOICED_TO_PAID", FACTOR,
            TransitionContext.builder().data("paymentAmount", RATE).build()),
        new Step(LoadState.COMPLETE, "PAID_TO_COMPLETE", Actor.system(), TransitionContext.empty())
    );

    protected MutableClock clock;
    protected TransitionCatalog catalog;
    protected InMemoryLoadStore loadStore;
    protected InMemoryConvoyStore convoyStore;
    protected InMemoryBroadcastHub hub;
    protected InMemoryFinancialLedger ledger;
    protected InMemoryOutboundGateway gateway;
    protected InMemoryHoursOfServiceService hoursOfService;
    protected InMemoryApprovalService approvals;
    protected AsyncEffectDispatcher effectDispatcher;
    protected ConvoySyncService convoySync;
    protected TransitionEngine engine;
    protected ScheduledSweepRunner sweepRunner;

    private final AtomicInteger convoySequence = new AtomicInteger();

    /**
     * Sets up test fixtures before each test.
     *
     * <p>Creates fresh instances of every store, sink and service.</p>
     */
    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        catalog = TransitionCatalog.standard();
        loadStore = new InMemoryLoadStore();
        convoyStore = new InMemoryConvoyStore();
        hub = new InMemoryBroadcastHub();
        hub.start();
        ledger = new InMemoryFinancialLedger();
        gateway = new InMemoryOutboundGateway();
        hoursOfService = new InMemoryHoursOfServiceService();
        approvals = new InMemoryApprovalService();

        effectDispatcher = new AsyncEffectDispatcher(
            List.of(
                new NotificationEffectHandler(hub, clock),
                new BroadcastEffectHandler(hub, clock),
                new FinancialEffectHandler(loadStore, ledger, clock),
                new OutboundEffectHandler(gateway)
            ),
            new EffectDispatchConfig().withBackoff(1, 10, 0.0),
            clock
        );

        convoySync = new ConvoySyncService(convoyStore, loadStore, hub, effectDispatcher,
            new SeparationMonitor(new SeparationConfig(), hub, clock), clock,
            () -> ConvoyId.of("convoy-" + convoySequence.incrementAndGet()));

        engine = new TransitionEngine(
            catalog,
            loadStore,
            StandardGuards.registry(catalog, hoursOfService, approvals, new GeofenceConfig()),
            effectDispatcher,
            List.of(convoySync),
            clock,
            new EngineConfig()
        );

        SweeperConfig sweeperConfig = new SweeperConfig();
        sweepRunner = new ScheduledSweepRunner(List.of(
            new AutoTransitionSweeper(engine, loadStore, catalog, clock, sweeperConfig),
            new ConvoySyncTimeoutSweeper(convoyStore, convoySync, hub, clock, sweeperConfig)
        ), sweeperConfig.scanIntervalMs());
    }

    /**
     * Cleans up test fixtures after each test.
     *
     * <p>Stops worker pools and clears in-memory state to prevent test interference.</p>
     */
    @AfterEach
    void tearDown() throws InterruptedException {
        if (sweepRunner != null) {
            sweepRunner.stop();
        }
        if (engine != null) {
            engine.shutdown();
        }
        if (effectDispatcher != null) {
            effectDispatcher.shutdown();
        }
        if (hub != null) {
            hub.stop();
        }
        if (loadStore != null) {
            loadStore.clear();
        }
        if (convoyStore != null) {
            convoyStore.clear();
        }
    }

    /**
     * Seeds a DRAFT load that satisfies every publish guard.
     *
     * @param loadIdValue the load ID value (e.g., "LOAD-001")
     * @return the seeded load's ID
     */
    protected LoadId seedPublishableDraft(String loadIdValue) {
        LoadId loadId = LoadId.of(loadIdValue);
        loadStore.seed(Load.draft(loadId, SHIPPER.actorId(), clock.instant())
            .withRoute(PICKUP, DELIVERY)
            .withRate(RATE)
            .withPickupAt(clock.instant().plus(Duration.ofDays(2))));
        return loadId;
    }

    /**
     * Attempts a transition and fails the test unless it commits.
     */
    protected Committed commit(LoadId loadId, String transitionId, Actor actor, TransitionContext context) {
        TransitionOutcome outcome = engine.attemptTransition(loadId, transitionId, actor, context);
        if (outcome instanceof Rejected rejected) {
            fail(String.format("Expected %s to commit for load %s but was rejected: %s - %s",
                transitionId, loadId, rejected.error().code(), rejected.error().message()));
        }
        return (Committed) outcome;
    }

    /**
     * Attempts a transition and fails the test unless it is rejected.
     */
    protected Rejected reject(LoadId loadId, String transitionId, Actor actor, TransitionContext context) {
        TransitionOutcome outcome = engine.attemptTransition(loadId, transitionId, actor, context);
        assertInstanceOf(Rejected.class, outcome,
            String.format("Expected %s to be rejected for load %s", transitionId, loadId));
        return (Rejected) outcome;
    }

    /**
     * Drives a load along the happy path until it reaches the target state.
     *
     * @param loadId the load to drive (must currently sit on the happy path)
     * @param target the state to stop at
     */
    protected void driveTo(LoadId loadId, LoadState target) {
        LoadState current = currentState(loadId);
        if (current == target) {
            return;
        }
        boolean started = current == LoadState.DRAFT;
        for (Step step : HAPPY_PATH) {
            if (!started) {
                started = catalog.transitionById(step.transitionId())
                    .map(definition -> definition.originatesFrom(current))
                    .orElse(false);
            }
            if (!started) {
                continue;
            }
            commit(loadId, step.transitionId(), step.actor(), step.context());
            if (step.reaches() == target) {
                return;
            }
        }
        fail(String.format("State %s is not reachable from %s on the happy path", target, current));
    }

    /**
     * Creates a convoy for the load and walks the escorts through staging.
     *
     * @return the convoy after staging (sync points already applied)
     */
    protected Convoy stageConvoy(LoadId loadId) {
        Convoy convoy = convoySync.createConvoy(loadId, LEAD_ESCORT.actorId(), "escort-rear", DRIVER.actorId());
        convoySync.transitionEscort(convoy.convoyId(), EscortState.AT_STAGING, LEAD_ESCORT);
        convoySync.transitionEscort(convoy.convoyId(), EscortState.EQUIPMENT_CHECK, LEAD_ESCORT);
        return convoySync.transitionEscort(convoy.convoyId(), EscortState.STAGING_COMPLETE, LEAD_ESCORT);
    }

    /**
     * Waits until every dispatched effect has been handled or dead-lettered.
     */
    protected void awaitEffects() {
        assertTrue(effectDispatcher.awaitIdle(EFFECT_IDLE_TIMEOUT),
            "Effects did not drain within " + EFFECT_IDLE_TIMEOUT);
    }

    protected LoadState currentState(LoadId loadId) {
        return loadStore.findById(loadId)
            .orElseThrow(() -> new IllegalStateException("Load not found: " + loadId))
            .state();
    }

    /**
     * Asserts that the load is in the expected state.
     */
    protected void assertLoadState(LoadId loadId, LoadState expectedState) {
        LoadState actualState = currentState(loadId);
        assertEquals(expectedState, actualState,
            String.format("Expected load state %s but was %s for loadId: %s", expectedState, actualState, loadId));
    }

    /**
     * Asserts that the convoy is in the expected escort state.
     */
    protected void assertEscortState(ConvoyId convoyId, EscortState expectedState) {
        EscortState actualState = convoyStore.findById(convoyId)
            .orElseThrow(() -> new IllegalStateException("Convoy not found: " + convoyId))
            .status();
        assertEquals(expectedState, actualState,
            String.format("Expected escort state %s but was %s for convoyId: %s", expectedState, actualState, convoyId));
    }

    private record Step(LoadState reaches, String transitionId, Actor actor, TransitionContext context) {
    }
}
