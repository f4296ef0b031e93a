package com.ryuqq.loadlifecycle.core.model;

/**
 * Load에 기록되는 문서 플래그.
 *
 * <p>문서 가드(document guard)는 이 플래그의 존재 여부만 검사합니다.
 * 문서 본문의 저장과 검증은 외부 문서 서비스의 책임입니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public enum LoadDocument {
    PRE_TRIP_INSPECTION("pre_trip_inspection"),
    BOL_SIGNED("bol_signed"),
    SEAL_NUMBERS("seal_numbers"),
    WEIGHT_TICKET("weight_ticket"),
    POD_PHOTO("pod_photo"),
    POD_SIGNATURE("pod_signature"),
    POD_VERIFIED("pod_verified"),
    EXCEPTION_PHOTOS("exception_photos"),
    DAMAGE_REPORT("damage_report"),
    INVOICE("invoice");

    private final String code;

    LoadDocument(String code) {
        this.code = code;
    }

    /**
     * 외부 시스템과 주고받는 문서 코드.
     *
     * @return 소문자 스네이크 케이스 코드 (예: bol_signed)
     */
    public String code() {
        return code;
    }
}
