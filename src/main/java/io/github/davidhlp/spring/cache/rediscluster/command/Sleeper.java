package io.github.davidhlp.spring.cache.rediscluster.command;

/** 重试前的等待。 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
