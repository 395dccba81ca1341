package cn.hjw.dev.retry.exception;

import java.util.List;

/**
 * 聚合异常：按发生顺序保存每次失败的异常
 * getMessage() 返回最后一次失败的信息，完整列表通过 getErrors() 获取
 */
public class RetryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<Exception> errors;

    public RetryException(List<? extends Exception> errors) {
        super(lastOf(errors));
        this.errors = List.copyOf(errors);
    }

    /**
     * @return 全部失败异常 (只读，按尝试顺序)
     */
    public List<Exception> getErrors() {
        return errors;
    }

    public Exception getLastError() {
        return errors.get(errors.size() - 1);
    }

    public int size() {
        return errors.size();
    }

    @Override
    public String getMessage() {
        return getLastError().getMessage();
    }

    private static Exception lastOf(List<? extends Exception> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("RetryException requires at least one error");
        }
        return errors.get(errors.size() - 1);
    }
}
