package com.tencent.hpcflow.domain.monitor;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * MonitoringStream - 按固定节奏产生监控帧的惰性序列
 * <p>
 * 每次 {@link #iterator()} 都从头开始；第一帧立即产生，之后每隔 interval 产生一帧，
 * 直到产出终态帧或被取消。取消是协作式的，会唤醒正在等待的迭代器。
 * </p>
 */
public class MonitoringStream implements Iterable<MonitoringFrame> {

    private final Supplier<MonitoringFrame> source;

    private final Duration interval;

    private final Set<FrameIterator> live = ConcurrentHashMap.newKeySet();

    public MonitoringStream(Supplier<MonitoringFrame> source, Duration interval) {
        this.source = source;
        this.interval = interval;
    }

    @Override
    public Iterator<MonitoringFrame> iterator() {
        FrameIterator iterator = new FrameIterator();
        live.add(iterator);
        return iterator;
    }

    public Stream<MonitoringFrame> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    /**
     * 取消当前所有迭代；之后再调用 iterator() 会重新开始
     */
    public void cancel() {
        live.forEach(FrameIterator::cancel);
        live.clear();
    }

    public Duration getInterval() {
        return interval;
    }

    private final class FrameIterator implements Iterator<MonitoringFrame> {

        private final CountDownLatch cancelled = new CountDownLatch(1);

        private MonitoringFrame pending;

        private boolean started;

        private boolean finished;

        @Override
        public boolean hasNext() {
            if (pending != null) {
                return true;
            }
            if (finished) {
                return false;
            }
            try {
                boolean stop = started
                        ? cancelled.await(interval.toMillis(), TimeUnit.MILLISECONDS)
                        : cancelled.getCount() == 0;
                if (stop) {
                    finish();
                    return false;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                finish();
                return false;
            }
            started = true;
            pending = source.get();
            return true;
        }

        @Override
        public MonitoringFrame next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            MonitoringFrame frame = pending;
            pending = null;
            if (frame.isTerminal()) {
                finish();
            }
            return frame;
        }

        void cancel() {
            cancelled.countDown();
        }

        private void finish() {
            finished = true;
            live.remove(this);
        }
    }
}
