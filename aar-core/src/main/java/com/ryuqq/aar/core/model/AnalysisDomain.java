package com.ryuqq.aar.core.model;

import java.util.regex.Pattern;

/**
 * 분석 도메인 구분자.
 *
 * <p>AnalysisDomain은 분석 영역을 구분하며, 어떤 분석 엔진이 Task를 처리할지 결정합니다.
 * 도메인당 최대 하나의 엔진만 등록될 수 있습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>AnalysisDomain.SAFETY - 병사 안전 분석</li>
 *   <li>AnalysisDomain.ACTIVITY - 활동량 분석</li>
 *   <li>AnalysisDomain.of("COMBAT_EFFECTIVENESS") - 사용자 정의 도메인</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~50자</li>
 *   <li>패턴: 대문자와 언더스코어만 허용 (예: SAFETY, NETWORK_PERFORMANCE)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AnalysisDomain {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[A-Z_]+$");

    public static final AnalysisDomain SAFETY = new AnalysisDomain("SAFETY");
    public static final AnalysisDomain NETWORK = new AnalysisDomain("NETWORK");
    public static final AnalysisDomain ACTIVITY = new AnalysisDomain("ACTIVITY");
    public static final AnalysisDomain EQUIPMENT = new AnalysisDomain("EQUIPMENT");
    public static final AnalysisDomain ENVIRONMENTAL = new AnalysisDomain("ENVIRONMENTAL");

    private final String value;

    private AnalysisDomain(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("AnalysisDomain cannot be null or blank");
        }
        if (value.length() > 50) {
            throw new IllegalArgumentException("AnalysisDomain length cannot exceed 50 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("AnalysisDomain must contain only uppercase letters and underscores");
        }
        this.value = value;
    }

    /**
     * AnalysisDomain 생성.
     *
     * @param value 도메인 값 (예: SAFETY, ACTIVITY)
     * @return AnalysisDomain 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static AnalysisDomain of(String value) {
        return new AnalysisDomain(value);
    }

    /**
     * 도메인 값 조회.
     *
     * @return 도메인 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AnalysisDomain domain = (AnalysisDomain) o;
        return value.equals(domain.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "AnalysisDomain{" + value + '}';
    }
}
