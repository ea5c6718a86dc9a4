package com.ryuqq.pipeline.core.executor;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 워크스페이스 파일 하나의 내용 (불투명한 바이트열).
 *
 * <p>엔진은 내용을 해석하지 않습니다. 텍스트로 읽는 곳은 dotenv 리포트뿐입니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 시와 조회 시 모두 배열을 복사합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FileContent {

    private static final FileContent EMPTY = new FileContent(new byte[0]);

    private final byte[] bytes;

    private FileContent(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * 바이트열로 생성.
     *
     * @param bytes 파일 내용 (null이면 빈 내용)
     * @return FileContent
     */
    public static FileContent of(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return EMPTY;
        }
        return new FileContent(bytes.clone());
    }

    /**
     * UTF-8 텍스트로 생성.
     */
    public static FileContent ofText(String text) {
        return text == null ? EMPTY : of(text.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    /**
     * UTF-8로 해석한 내용. 잘못된 바이트는 대체 문자로 바뀝니다.
     */
    public String asText() {
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
        FileContent that = (FileContent) o;
        return Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "FileContent{" + bytes.length + " bytes}";
    }
}
