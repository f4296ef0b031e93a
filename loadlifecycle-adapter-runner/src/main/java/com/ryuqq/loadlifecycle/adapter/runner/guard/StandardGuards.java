package com.ryuqq.loadlifecycle.adapter.runner.guard;

import com.ryuqq.loadlifecycle.core.catalog.TransitionCatalog;
import com.ryuqq.loadlifecycle.core.guard.GuardContext;
import com.ryuqq.loadlifecycle.core.guard.GuardEvaluator;
import com.ryuqq.loadlifecycle.core.guard.GuardRegistry;
import com.ryuqq.loadlifecycle.core.guard.GuardVerdict;
import com.ryuqq.loadlifecycle.core.model.ActorRole;
import com.ryuqq.loadlifecycle.core.model.LoadDocument;
import com.ryuqq.loadlifecycle.core.spi.ApprovalService;
import com.ryuqq.loadlifecycle.core.spi.HoursOfServiceService;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * 표준 카탈로그가 선언한 모든 가드 식별자의 평가기 등록.
 *
 * <p><strong>데이터 가드:</strong> 저장된 Load 필드, 요청의 참여자 배정, 요청 데이터
 * ({@code bidId}, {@code carrierId}, {@code driverId}, {@code weight}, {@code sealNumbers})를 읽습니다.</p>
 *
 * <p><strong>문서 가드:</strong> Load에 이미 기록된 문서 또는 이번 요청으로 제출된 문서를 인정합니다.</p>
 *
 * <p><strong>승인 가드:</strong> {@code rate_within_limit}은 요청의 {@code bidAmount}(없으면 Load 운임)를,
 * {@code payment_amount_valid}는 요청의 {@code paymentAmount}를 {@link ApprovalService}로 확인합니다.</p>
 *
 * <p>등록 후 개별 식별자는 {@link GuardRegistry#override(String, GuardEvaluator)}로 교체할 수 있습니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class StandardGuards {

    // Utility class - prevent instantiation
    private StandardGuards() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 표준 가드 레지스트리 생성.
     *
     * @param catalog 시간 가드가 참조할 카탈로그
     * @param hoursOfService HOS 서비스
     * @param approvals 승인 서비스
     * @param geofence 지오펜스 설정
     * @return 모든 표준 가드가 등록된 레지스트리
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static GuardRegistry registry(
        TransitionCatalog catalog,
        HoursOfServiceService hoursOfService,
        ApprovalService approvals,
        GeofenceConfig geofence
    ) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog cannot be null");
        }
        if (hoursOfService == null) {
            throw new IllegalArgumentException("hoursOfService cannot be null");
        }
        if (approvals == null) {
            throw new IllegalArgumentException("approvals cannot be null");
        }
        if (geofence == null) {
            throw new IllegalArgumentException("geofence cannot be null");
        }

        GuardRegistry registry = new GuardRegistry();

        // DATA
        registry.register("has_pickup_location", ctx -> GuardVerdict.of(ctx.load().pickupLocation() != null));
        registry.register("has_delivery_location", ctx -> GuardVerdict.of(ctx.load().deliveryLocation() != null));
        registry.register("has_rate", ctx -> GuardVerdict.of(
            ctx.load().rate() != null && ctx.load().rate().signum() > 0));
        registry.register("has_carrier", ctx -> GuardVerdict.of(
            hasParticipant(ctx, ActorRole.CATALYST) || hasData(ctx, "carrierId")));
        registry.register("has_winning_bid", ctx -> GuardVerdict.of(hasData(ctx, "bidId")));
        registry.register("has_driver", ctx -> GuardVerdict.of(
            hasParticipant(ctx, ActorRole.DRIVER) || hasData(ctx, "driverId")));
        registry.register("has_weight", ctx -> GuardVerdict.of(
            hasDocument(ctx, LoadDocument.WEIGHT_TICKET) || hasData(ctx, "weight")));
        registry.register("has_seal_numbers", ctx -> GuardVerdict.of(
            hasDocument(ctx, LoadDocument.SEAL_NUMBERS) || hasData(ctx, "sealNumbers")));

        // DOCUMENT
        registry.register("pre_trip_complete", ctx -> GuardVerdict.of(hasDocument(ctx, LoadDocument.PRE_TRIP_INSPECTION)));
        registry.register("bol_signed", ctx -> GuardVerdict.of(hasDocument(ctx, LoadDocument.BOL_SIGNED)));
        registry.register("pod_photo_present", ctx -> GuardVerdict.of(hasDocument(ctx, LoadDocument.POD_PHOTO)));
        registry.register("pod_signature_present", ctx -> GuardVerdict.of(hasDocument(ctx, LoadDocument.POD_SIGNATURE)));

        // TIME
        registry.register("pickup_date_future", ctx -> GuardVerdict.of(
            ctx.load().pickupAt() != null && ctx.load().pickupAt().isAfter(ctx.now())));
        GuardEvaluator elapsed = new ElapsedInStateGuardEvaluator(catalog);
        registry.register("past_deadline", elapsed);
        registry.register("award_expired_2hr", elapsed);
        registry.register("confirmation_window_elapsed", elapsed);
        registry.register("pod_24h_elapsed", elapsed);

        // LOCATION
        registry.register("within_pickup_geofence",
            new GeofenceGuardEvaluator(GeofenceGuardEvaluator.Facility.PICKUP, geofence));
        registry.register("within_delivery_geofence",
            new GeofenceGuardEvaluator(GeofenceGuardEvaluator.Facility.DELIVERY, geofence));

        // HOURS_OF_SERVICE
        registry.register("driver_has_hours", new HoursOfServiceGuardEvaluator(hoursOfService));

        // APPROVAL
        registry.register("rate_within_limit", ctx -> {
            BigDecimal amount = amountOf(ctx, "bidAmount").orElse(ctx.load().rate());
            if (amount == null) {
                return GuardVerdict.fail("No rate available for approval check");
            }
            return GuardVerdict.of(approvals.isWithinApprovalLimit(ctx.actor(), amount));
        });
        registry.register("payment_amount_valid", ctx -> amountOf(ctx, "paymentAmount")
            .map(amount -> GuardVerdict.of(approvals.isPaymentValid(ctx.load(), amount)))
            .orElseGet(() -> GuardVerdict.fail("Payment amount required")));

        return registry;
    }

    private static boolean hasParticipant(GuardContext ctx, ActorRole role) {
        return ctx.load().participant(role).isPresent() || ctx.request().assignments().containsKey(role);
    }

    private static boolean hasDocument(GuardContext ctx, LoadDocument document) {
        return ctx.load().hasDocument(document) || ctx.request().documents().contains(document);
    }

    private static boolean hasData(GuardContext ctx, String key) {
        return ctx.request().dataValue(key)
            .filter(value -> !(value instanceof String s) || !s.isBlank())
            .isPresent();
    }

    /**
     * 요청 데이터에서 금액 추출.
     *
     * <p>BigDecimal, Number, 숫자 형식의 String을 허용합니다.</p>
     */
    private static Optional<BigDecimal> amountOf(GuardContext ctx, String key) {
        return ctx.request().dataValue(key).flatMap(value -> {
            if (value instanceof BigDecimal decimal) {
                return Optional.of(decimal);
            }
            if (value instanceof Number number) {
                return Optional.of(new BigDecimal(number.toString()));
            }
            if (value instanceof String text && text.trim().matches("-?\\d+(\\.\\d+)?")) {
                return Optional.of(new BigDecimal(text.trim()));
            }
            return Optional.empty();
        });
    }
}
