package com.tencent.hpcflow.domain.pkg;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Optional;

/**
 * ParameterConstraint - 参数约束（值对象）
 * <p>
 * 对参数值的约束条件，违反时返回可读的原因。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParameterConstraint {

    /**
     * 正则表达式（字符串）
     */
    private String pattern;

    /**
     * 最小长度（字符串或数组）
     */
    private Integer minLength;

    /**
     * 最大长度（字符串或数组）
     */
    private Integer maxLength;

    /**
     * 允许的值列表
     */
    private List<Object> enumValues;

    /**
     * 最小值（数字）
     */
    private Double minValue;

    /**
     * 最大值（数字）
     */
    private Double maxValue;

    /**
     * 检查值，返回违反原因；满足约束时返回空
     */
    public Optional<String> check(Object value, ParameterType type) {
        if (value == null) {
            return Optional.empty(); // null 由 required 控制
        }
        switch (type) {
            case STRING:
                return checkString((String) value);
            case INTEGER:
            case NUMBER:
                return checkNumber(((Number) value).doubleValue(), value);
            case ARRAY:
                return checkSize(((List<?>) value).size());
            default:
                return Optional.empty();
        }
    }

    private Optional<String> checkString(String value) {
        Optional<String> size = checkSize(value.length());
        if (size.isPresent()) {
            return size;
        }
        if (pattern != null && !value.matches(pattern)) {
            return Optional.of("value '" + value + "' does not match pattern " + pattern);
        }
        if (enumValues != null && !enumValues.contains(value)) {
            return Optional.of("value '" + value + "' is not one of " + enumValues);
        }
        return Optional.empty();
    }

    private Optional<String> checkNumber(double number, Object raw) {
        if (minValue != null && number < minValue) {
            return Optional.of("value " + raw + " is below minimum " + minValue);
        }
        if (maxValue != null && number > maxValue) {
            return Optional.of("value " + raw + " is above maximum " + maxValue);
        }
        if (enumValues != null && enumValues.stream()
                .noneMatch(allowed -> allowed instanceof Number && ((Number) allowed).doubleValue() == number)) {
            return Optional.of("value " + raw + " is not one of " + enumValues);
        }
        return Optional.empty();
    }

    private Optional<String> checkSize(int size) {
        if (minLength != null && size < minLength) {
            return Optional.of("length " + size + " is shorter than " + minLength);
        }
        if (maxLength != null && size > maxLength) {
            return Optional.of("length " + size + " is longer than " + maxLength);
        }
        return Optional.empty();
    }
}
