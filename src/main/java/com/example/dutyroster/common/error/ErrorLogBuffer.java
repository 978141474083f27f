package com.example.dutyroster.common.error;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * 直近の失敗（人員不足・競合・想定外の例外）を新しい順に保持するリングバッファ。
 */
@Component
public class ErrorLogBuffer {

    private final Deque<Entry> entries = new ConcurrentLinkedDeque<>();
    private final int capacity;
    private final Clock clock;

    public ErrorLogBuffer(@Value("${roster.errors.capacity:200}") int capacity, Clock clock) {
        this.capacity = Math.max(1, capacity);
        this.clock = clock;
    }

    public void addError(String code, String message, Throwable cause) {
        String detail = cause == null ? "" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        entries.addFirst(new Entry(LocalDateTime.now(clock), code, message == null ? "" : message, detail));
        while (entries.size() > capacity) {
            entries.pollLast();
        }
    }

    public List<Entry> recent() {
        return List.copyOf(entries);
    }

    public List<Entry> recent(int limit) {
        return entries.stream().limit(Math.max(0, limit)).toList();
    }

    public void clear() {
        entries.clear();
    }

    public int getCapacity() {
        return capacity;
    }

    public record Entry(LocalDateTime time, String code, String message, String detail) {}
}
