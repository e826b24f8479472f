package com.example.image2excel.domain.model;

import java.util.List;

/**
 * Two-stop color scale for one channel: {@value #LOW_VALUE} renders black and {@value #HIGH_VALUE}
 * renders the channel's full color. A single rule is bound to every range of its channel.
 *
 * @param channel channel the rule colors
 * @param ranges  single-column ranges covering exactly the channel's columns, never empty
 */
public record GradientRule(ColorChannel channel, List<CellRange> ranges) {

    public static final int LOW_VALUE = 0;
    public static final int HIGH_VALUE = 255;
    public static final int LOW_COLOR = 0x000000;

    public GradientRule {
        if (ranges == null || ranges.isEmpty()) {
            throw new IllegalArgumentException("A gradient rule needs at least one range: " + channel);
        }
        ranges = List.copyOf(ranges);
    }

    public int highColor() {
        return channel.fullColor();
    }
}
