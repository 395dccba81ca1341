package cn.hjw.dev.retry.config;

import cn.hjw.dev.retry.condition.RetryCondition;
import cn.hjw.dev.retry.hook.RetryListener;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.concurrent.TimeUnit;

/**
 * 重试配置：
 * 1. 每次调用都从默认值新建，互不共享
 * 2. 按顺序应用 RetryOption，后者覆盖前者
 * 3. 构建后不可变，不做参数校验
 */
@Getter
@Builder
@ToString
public class RetryConfig {

    // --- 次数配置 ---
    @Builder.Default
    private int attempts = 10; // 最大尝试次数 (含首次)

    // --- 间隔配置 ---
    @Builder.Default
    private long delay = 100;

    @Builder.Default
    private TimeUnit unit = TimeUnit.MILLISECONDS;

    // --- 回调配置 ---
    @Builder.Default
    @ToString.Exclude
    private RetryListener onRetry = (attempt, cause) -> { };

    @Builder.Default
    @ToString.Exclude
    private RetryCondition retryIf = cause -> true;

    /**
     * 默认配置 + 按顺序应用选项
     * @param options 选项 (null 元素忽略)
     * @return 新的配置实例
     */
    public static RetryConfig of(RetryOption... options) {
        RetryConfigBuilder builder = RetryConfig.builder();
        if (options != null) {
            for (RetryOption option : options) {
                if (option != null) {
                    option.apply(builder);
                }
            }
        }
        return builder.build();
    }
}
