package com.ryuqq.loadlifecycle.adapter.inmemory.external;

import com.ryuqq.loadlifecycle.core.model.Actor;
import com.ryuqq.loadlifecycle.core.model.ActorRole;
import com.ryuqq.loadlifecycle.core.model.Load;
import com.ryuqq.loadlifecycle.core.model.LoadId;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InMemoryApprovalService 테스트.
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
class InMemoryApprovalServiceTest {

    private final InMemoryApprovalService service = new InMemoryApprovalService();

    @Test
    void 한도가_없는_역할은_무제한() {
        assertThat(service.isWithinApprovalLimit(Actor.of("s1", ActorRole.SHIPPER), new BigDecimal("99999"))).isTrue();
    }

    @Test
    void 사용자_한도가_역할_한도보다_우선함() {
        service.setRoleLimit(ActorRole.BROKER, new BigDecimal("5000"));
        service.setUserLimit("senior-broker", new BigDecimal("20000"));

        assertThat(service.isWithinApprovalLimit(Actor.of("broker", ActorRole.BROKER), new BigDecimal("6000"))).isFalse();
        assertThat(service.isWithinApprovalLimit(Actor.of("senior-broker", ActorRole.BROKER), new BigDecimal("6000"))).isTrue();
    }

    @Test
    void 지급액은_운임과_같아야_유효함() {
        Load load = Load.draft(LoadId.of("1"), "s1", Instant.EPOCH).withRate(new BigDecimal("2500.00"));

        assertThat(service.isPaymentValid(load, new BigDecimal("2500"))).isTrue();
        assertThat(service.isPaymentValid(load, new BigDecimal("2400"))).isFalse();
        assertThat(service.isPaymentValid(load, null)).isFalse();
    }
}
