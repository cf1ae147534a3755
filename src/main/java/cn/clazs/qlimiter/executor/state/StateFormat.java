package cn.clazs.qlimiter.executor.state;

/**
 * 状态编解码的公共方法
 *
 * <p>格式：字段之间用逗号分隔；实数使用 {@link Double#toString(double)}，解析后与原值完全一致
 *
 * @author clazs
 * @since 1.0.0
 */
final class StateFormat {

    static final String FIELD_SEPARATOR = ",";

    private StateFormat() {
        throw new AssertionError("工具类禁止实例化");
    }

    /**
     * 按逗号拆分并校验字段数量
     *
     * @throws IllegalArgumentException 字段数量不符
     */
    static String[] split(String raw, int expectedFields, String typeName) {
        if (raw == null) {
            throw new IllegalArgumentException(typeName + " 不能为 null");
        }
        String[] fields = raw.split(FIELD_SEPARATOR, -1);
        if (fields.length != expectedFields) {
            throw new IllegalArgumentException(
                    typeName + " 字段数量错误: expected=" + expectedFields + ", actual=" + fields.length);
        }
        return fields;
    }

    static long parseLong(String field, String typeName) {
        try {
            return Long.parseLong(field);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(typeName + " 无法解析整数: " + field, e);
        }
    }

    static double parseDouble(String field, String typeName) {
        try {
            double value = Double.parseDouble(field);
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new IllegalArgumentException(typeName + " 非法实数: " + field);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(typeName + " 无法解析实数: " + field, e);
        }
    }
}
