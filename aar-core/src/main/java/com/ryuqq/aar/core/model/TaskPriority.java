package com.ryuqq.aar.core.model;

/**
 * Task 우선순위 수준.
 *
 * <p>값이 작을수록 먼저 디스패치됩니다. 동일 우선순위에서는 제출 순서(FIFO)를 따릅니다.</p>
 *
 * <p>임의의 정수 우선순위도 허용되며, 이 enum은 자주 쓰이는 수준에 이름을 붙인 것입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TaskPriority {

    /**
     * 즉시 처리 (가장 긴급).
     */
    CRITICAL(0),

    /**
     * 높음 (동기 일괄 분석에서 사용).
     */
    HIGH(1),

    /**
     * 보통 (기본값).
     */
    NORMAL(2),

    /**
     * 낮음.
     */
    LOW(3);

    private final int value;

    TaskPriority(int value) {
        this.value = value;
    }

    /**
     * 정수 우선순위 값 조회.
     *
     * @return 우선순위 값 (작을수록 긴급)
     */
    public int value() {
        return value;
    }
}
