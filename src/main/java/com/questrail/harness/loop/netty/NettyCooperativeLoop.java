package com.questrail.harness.loop.netty;

import com.questrail.harness.loop.CooperativeLoop;
import com.questrail.harness.time.Cancellable;

import io.netty.channel.DefaultEventLoop;
import io.netty.channel.EventLoop;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.ScheduledFuture;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyCooperativeLoop
 * =============================================================================
 * Netty-backed implementation of the {@link CooperativeLoop} port.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code EventLoop}, {@code ScheduledFuture}) MUST NOT escape this
 * package. Timers are exposed as {@link Cancellable} only.
 *
 * <p>Netty's scheduled-task queue orders timers by deadline and, for equal
 * deadlines, by creation order, which is exactly the ordering the timer wheel
 * requires from a backend.</p>
 *
 * <h2>Lifecycle</h2>
 * The loop thread starts lazily on the first submitted task. {@link #shutdown()}
 * shuts the loop down with a zero quiet period and waits up to five seconds for
 * the thread to finish.
 */
public final class NettyCooperativeLoop implements CooperativeLoop
{
    private final EventLoop loop;

    public NettyCooperativeLoop(String threadName)
    {
        Objects.requireNonNull(threadName, "threadName");
        this.loop = new DefaultEventLoop(new DefaultThreadFactory(threadName, true));
    }

    @Override
    public void execute(Runnable task)
    {
        loop.execute(Objects.requireNonNull(task, "task"));
    }

    @Override
    public Cancellable schedule(long delayNanos, Runnable task)
    {
        Objects.requireNonNull(task, "task");
        ScheduledFuture<?> future = loop.schedule(task, Math.max(0L, delayNanos), TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public boolean inLoop()
    {
        return loop.inEventLoop();
    }

    @Override
    public void shutdown()
    {
        if (loop.isShuttingDown()) {
            return;
        }
        loop.shutdownGracefully(0, 5, TimeUnit.SECONDS).awaitUninterruptibly(5, TimeUnit.SECONDS);
    }
}
