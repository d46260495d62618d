package cn.bafuka.configarmor.repository;

import java.util.NoSuchElementException;

/**
 * 按键查询的结果：找到或不存在
 * “不存在”是正常分支，不用异常表达
 *
 * @param <R> 记录类型
 */
public final class FetchResult<R> {

    private static final FetchResult<?> NOT_FOUND = new FetchResult<>(null);

    private final R record;

    private FetchResult(R record) {
        this.record = record;
    }

    public static <R> FetchResult<R> found(R record) {
        if (record == null) {
            throw new IllegalArgumentException("record 不能为空");
        }
        return new FetchResult<>(record);
    }

    @SuppressWarnings("unchecked")
    public static <R> FetchResult<R> notFound() {
        return (FetchResult<R>) NOT_FOUND;
    }

    public boolean isFound() {
        return record != null;
    }

    /**
     * @return 记录
     * @throws NoSuchElementException 不存在时
     */
    public R getRecord() {
        if (record == null) {
            throw new NoSuchElementException("记录不存在");
        }
        return record;
    }

    @Override
    public String toString() {
        return isFound() ? "FetchResult.found(" + record + ")" : "FetchResult.notFound()";
    }
}
