package com.scrapebatch.core.store;

import java.io.IOException;
import java.util.Optional;

/**
 * 이름 → 텍스트 blob 저장소.
 * 쓰기는 all-or-nothing: 읽는 쪽은 완전한 내용이거나 "없음"만 본다.
 */
public interface AtomicStore {

    /** 같은 이름이 있으면 통째로 교체. 재시도 소진 시 {@link DurableWriteException}. */
    void write(String name, String content) throws IOException;

    /** 없으면 Optional.empty() (에러 아님) */
    Optional<String> read(String name) throws IOException;

    /** @return 실제로 지웠으면 true. 없던 이름도 예외 없이 false. */
    boolean delete(String name) throws IOException;
}
