package com.ryuqq.loadlifecycle.adapter.runner.effect;

import com.ryuqq.loadlifecycle.core.catalog.EffectKind;
import com.ryuqq.loadlifecycle.core.model.ActorRole;
import com.ryuqq.loadlifecycle.core.spi.ChannelKeys;
import com.ryuqq.loadlifecycle.core.spi.EffectHandler;
import com.ryuqq.loadlifecycle.core.spi.EffectRequest;
import com.ryuqq.loadlifecycle.core.spi.OutboundGateway;
import com.ryuqq.loadlifecycle.core.spi.OutboundMessage;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 외부 시스템으로 나가는 효과 핸들러 (EMAIL, SMS, DATABASE, DOCUMENT, INTEGRATION).
 *
 * <p>수신 역할은 배정된 사용자 ID로, 배정이 없으면 역할 채널 키로 변환해 전달합니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class OutboundEffectHandler implements EffectHandler {

    private static final Set<EffectKind> KINDS = EnumSet.of(
        EffectKind.EMAIL,
        EffectKind.SMS,
        EffectKind.DATABASE,
        EffectKind.DOCUMENT,
        EffectKind.INTEGRATION
    );

    private final OutboundGateway gateway;

    public OutboundEffectHandler(OutboundGateway gateway) {
        if (gateway == null) {
            throw new IllegalArgumentException("gateway cannot be null");
        }
        this.gateway = gateway;
    }

    @Override
    public Set<EffectKind> kinds() {
        return KINDS;
    }

    @Override
    public void handle(EffectRequest request) {
        List<String> recipients = new ArrayList<>();
        for (ActorRole role : request.effect().recipients()) {
            String userId = request.participants().get(role);
            recipients.add(userId != null ? userId : ChannelKeys.role(role));
        }
        gateway.send(new OutboundMessage(
            request.effect().kind(),
            request.effect().action(),
            request.loadId(),
            request.transitionId(),
            recipients,
            request.effect().payload()
        ));
    }
}
