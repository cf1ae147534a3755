package cn.clazs.qlimiter.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 存储故障时的处理策略
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@AllArgsConstructor
public enum FailurePolicy {

    /**
     * 放行：存储故障不影响被保护的服务，但限流暂时失效
     */
    FAIL_OPEN("fail-open", "故障放行"),

    /**
     * 拒绝：保证限流语义，代价是可用性
     */
    FAIL_CLOSED("fail-closed", "故障拒绝");

    private final String code;
    private final String description;

    /**
     * 根据代码获取枚举值（兼容 fail_open / fail_closed）
     *
     * @param code 策略代码
     * @return 对应的策略枚举
     * @throws IllegalArgumentException 如果代码不存在
     */
    public static FailurePolicy fromCode(String code) {
        for (FailurePolicy policy : values()) {
            if (code != null && policy.code.equalsIgnoreCase(code.trim().replace('_', '-'))) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown failure policy code: " + code);
    }
}
