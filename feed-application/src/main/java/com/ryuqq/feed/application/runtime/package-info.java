/**
 * 오케스트레이터 생명주기.
 *
 * <p>{@link com.ryuqq.feed.application.runtime.Runtime} 은 워커 스레드와 업스트림 호출 스레드를
 * 띄우고 내리는 계약입니다. {@code start()} 이전의 조회 요청은 거부되며, {@code shutdown()} 은
 * 대기 중인 요청을 캐시 폴백으로 종결한 뒤 반환합니다.</p>
 *
 * <p>구현: adapter-runner 모듈의 {@code QueueWorkerRunner}.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.feed.application.runtime;
