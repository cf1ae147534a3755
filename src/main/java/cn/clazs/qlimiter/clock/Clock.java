package cn.clazs.qlimiter.clock;

/**
 * 时钟抽象
 *
 * <p>所有算法的"当前时间"都从这里获取，便于在测试中注入可控时钟
 * <p>返回毫秒级 epoch 时间戳：分布式存储下各节点需要共享同一时间基准
 *
 * @author clazs
 * @since 1.0.0
 */
public interface Clock {

    /**
     * 获取当前时间
     *
     * @return 毫秒级时间戳
     */
    long currentTimeMillis();
}
