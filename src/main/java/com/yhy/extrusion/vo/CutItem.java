package com.yhy.extrusion.vo;

import lombok.Builder;
import lombok.Value;

/**
 * One required piece of a cutting list.
 * <p>
 * Lengths are in millimetres. {@code tolerance} is the allowed deviation in both
 * directions, so a placed segment may measure anywhere in [minLength, maxLength].
 */
@Value
@Builder(toBuilder = true)
public class CutItem {
    String id;
    String profileType;
    double length;
    int quantity;
    double tolerance;
    Integer priority;
    String workOrderId;

    public double getMinLength() {
        return length - tolerance;
    }

    public double getMaxLength() {
        return length + tolerance;
    }

    public double getTotalLength() {
        return length * quantity;
    }

    public static CutItem of(String id, String profileType, double length, int quantity) {
        return CutItem.builder().id(id).profileType(profileType).length(length).quantity(quantity).build();
    }
}
