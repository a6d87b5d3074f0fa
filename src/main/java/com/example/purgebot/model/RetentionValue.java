package com.example.purgebot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.EqualsAndHashCode;

/**
 * 保留天数配置值。
 * -1 = 永不删除，0 = 删除所有可删除消息，N = 删除早于 N 天的消息。
 * 保留原始文本，非法值在解析阶段不报错，由 RetentionResolver 回退到全局默认值。
 */
@EqualsAndHashCode
public final class RetentionValue {

    public static final int NEVER_DELETE = -1;

    private final Integer days;
    private final String raw;

    private RetentionValue(Integer days, String raw) {
        this.days = days;
        this.raw = raw;
    }

    public static RetentionValue of(int days) {
        return new RetentionValue(days, Integer.toString(days));
    }

    public static RetentionValue invalid(String raw) {
        return new RetentionValue(null, raw);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RetentionValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            return of(node.intValue());
        }
        if (node.isFloatingPointNumber()) {
            double value = node.doubleValue();
            if (value == Math.rint(value) && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                return of((int) value);
            }
        }
        return invalid(node.isValueNode() ? node.asText() : node.toString());
    }

    @JsonValue
    public Object toJson() {
        return days != null ? days : raw;
    }

    /**
     * 是否满足 "整数且 >= -1" 约束。
     */
    public boolean isValid() {
        return days != null && days >= NEVER_DELETE;
    }

    public Integer getDays() {
        return days;
    }

    public String getRaw() {
        return raw;
    }

    @Override
    public String toString() {
        return raw;
    }

    public static String describe(int days) {
        if (days == NEVER_DELETE) {
            return "never delete";
        }
        if (days == 0) {
            return "delete all";
        }
        return days + " days";
    }
}
