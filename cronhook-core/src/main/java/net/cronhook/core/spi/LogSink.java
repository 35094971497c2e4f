package net.cronhook.core.spi;

import net.cronhook.core.model.ExecutionRecord;

/** 실행 기록 저장처. 실패는 예외로 알림 */
@FunctionalInterface
public interface LogSink {
    void record(ExecutionRecord record) throws Exception;
}
