package cn.bafuka.configarmor.exception;

/**
 * 更新目标记录不存在
 */
public class WriteConflictException extends ConfigAccessException {

    public WriteConflictException(String message, Object key) {
        super(message, key, FailureReason.WRITE_CONFLICT);
    }
}
