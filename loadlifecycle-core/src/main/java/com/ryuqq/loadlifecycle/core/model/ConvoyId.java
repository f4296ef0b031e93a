package com.ryuqq.loadlifecycle.core.model;

/**
 * Convoy의 전역 고유 식별자.
 *
 * <p>Convoy 감사 기록은 ConvoyId를 엔티티 키로 사용합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class ConvoyId {

    private final String value;

    private ConvoyId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ConvoyId cannot be null or blank");
        }
        if (value.length() > 128) {
            throw new IllegalArgumentException("ConvoyId length cannot exceed 128 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("ConvoyId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * ConvoyId 생성.
     *
     * @param value ConvoyId 값
     * @return ConvoyId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ConvoyId of(String value) {
        return new ConvoyId(value);
    }

    /**
     * ConvoyId 값 조회.
     *
     * @return ConvoyId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConvoyId convoyId = (ConvoyId) o;
        return value.equals(convoyId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ConvoyId{" + value + '}';
    }
}
