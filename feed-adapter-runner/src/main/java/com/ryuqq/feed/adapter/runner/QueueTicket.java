package com.ryuqq.feed.adapter.runner;

/**
 * 작업 큐 항목.
 *
 * <p>우선순위 순위가 작은 것부터, 같은 우선순위 안에서는 등록 순번이 작은 것부터 꺼냅니다.
 * 재시도는 새 순번으로 다시 등록되므로 같은 우선순위의 대기 요청 뒤에 섭니다.</p>
 *
 * @param request 요청
 * @param sequence 등록 순번
 * @author Orchestrator Team
 * @since 1.0.0
 */
record QueueTicket(PendingRequest request, long sequence) implements Comparable<QueueTicket> {

    @Override
    public int compareTo(QueueTicket other) {
        int byPriority = Integer.compare(request.priority().rank(), other.request.priority().rank());
        return byPriority != 0 ? byPriority : Long.compare(sequence, other.sequence);
    }
}
