package com.ryuqq.feed.core.model;

/**
 * 요청 우선순위.
 *
 * <p>작업 큐는 HIGH → NORMAL → LOW 순으로 요청을 꺼내며,
 * 같은 우선순위 안에서는 먼저 들어온 요청이 먼저 처리됩니다 (FIFO).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Priority {

    /** 경기 임박, 실시간 폴러 등 즉시 처리해야 하는 요청. */
    HIGH(0),

    /** 정기 갱신 등 일반 요청. */
    NORMAL(1),

    /** 프리페치, 백그라운드 워머 등 급하지 않은 요청. */
    LOW(2);

    private final int rank;

    Priority(int rank) {
        this.rank = rank;
    }

    /**
     * 정렬 순위 (작을수록 먼저 처리).
     *
     * @return 순위
     */
    public int rank() {
        return rank;
    }
}
