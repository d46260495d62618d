package cn.bafuka.configarmor.repository;

/**
 * 配置仓储契约
 * 基础设施故障以 {@link cn.bafuka.configarmor.exception.ConfigAccessException} 子类抛出
 *
 * @param <ID> 键类型
 * @param <R>  记录类型
 */
public interface ConfigRepository<ID, R> {

    /**
     * 按键查询
     *
     * @param id 键
     * @return 查询结果
     */
    FetchResult<R> fetchByKey(ID id);

    /**
     * 以默认值创建记录
     *
     * @param id 键
     * @return 创建后的记录
     */
    R create(ID id);

    /**
     * 更新记录
     *
     * @param record 记录
     * @throws cn.bafuka.configarmor.exception.WriteConflictException 目标记录不存在
     */
    void update(R record);
}
