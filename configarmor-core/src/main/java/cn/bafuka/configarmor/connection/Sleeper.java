package cn.bafuka.configarmor.connection;

/**
 * 退避等待
 * 抽出来便于测试时不真正睡眠
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    /**
     * 等待指定毫秒数，可被中断
     *
     * @param millis 毫秒
     * @throws InterruptedException 等待被中断
     */
    void sleep(long millis) throws InterruptedException;
}
