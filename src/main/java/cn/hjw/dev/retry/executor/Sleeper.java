package cn.hjw.dev.retry.executor;

import java.util.concurrent.TimeUnit;

/**
 * 重试间隔的挂起方式，默认阻塞当前线程
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = (duration, unit) -> unit.sleep(duration);

    void sleep(long duration, TimeUnit unit) throws InterruptedException;
}
