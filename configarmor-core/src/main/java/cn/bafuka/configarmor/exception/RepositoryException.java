package cn.bafuka.configarmor.exception;

/**
 * 非连接类的数据库错误（语法、约束、类型转换等）
 */
public class RepositoryException extends ConfigAccessException {

    public RepositoryException(String message, Throwable cause, Object key) {
        super(message, cause, key, FailureReason.DATABASE_ERROR);
    }
}
