package com.ryuqq.feed.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 외부 제공자로부터 받은 응답 본문의 불투명 바이트 표현.
 *
 * <p>이 계층은 Payload 의 내용을 해석하지 않습니다. JSON, CSV 등 형식은
 * 호출자(특징 추출 파이프라인 등)가 결정합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>JSON: Payload.ofUtf8("[{\"id\":\"g1\",\"commence_time\":\"2025-09-07T17:00:00Z\"}]")</li>
 *   <li>원본 바이트: Payload.of(responseBody)</li>
 *   <li>빈 Payload: Payload.empty()</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 시와 조회 시 모두 방어적 복사</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Payload {

    private static final Payload EMPTY = new Payload(new byte[0]);

    private final byte[] bytes;

    private Payload(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Payload 생성.
     *
     * @param bytes 원본 바이트 (복사되어 저장됨)
     * @return Payload 인스턴스
     * @throws IllegalArgumentException bytes 가 null 인 경우
     */
    public static Payload of(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        return new Payload(bytes.clone());
    }

    /**
     * UTF-8 문자열로부터 Payload 생성.
     *
     * @param text 본문 문자열
     * @return Payload 인스턴스
     * @throws IllegalArgumentException text 가 null 인 경우
     */
    public static Payload ofUtf8(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        return new Payload(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 빈 Payload.
     *
     * @return 빈 Payload 인스턴스
     */
    public static Payload empty() {
        return EMPTY;
    }

    /**
     * 바이트 사본 조회.
     *
     * @return 바이트 배열 사본
     */
    public byte[] toByteArray() {
        return bytes.clone();
    }

    /**
     * UTF-8 로 디코딩한 본문.
     *
     * @return 본문 문자열
     */
    public String asUtf8() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public int size() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return Arrays.equals(bytes, payload.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "Payload{" + bytes.length + " bytes}";
    }
}
