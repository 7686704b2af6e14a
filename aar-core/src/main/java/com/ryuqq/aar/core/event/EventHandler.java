package com.ryuqq.aar.core.event;

/**
 * 이벤트 구독자 콜백.
 *
 * <p>핸들러가 던진 예외는 버스가 격리합니다. 같은 이벤트의 다른 핸들러 호출이나
 * 버스 워커에는 영향을 주지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventHandler {

    /**
     * 이벤트 처리.
     *
     * @param event 전달된 이벤트
     */
    void onEvent(Event event);
}
