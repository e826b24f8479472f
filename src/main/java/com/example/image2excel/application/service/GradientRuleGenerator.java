package com.example.image2excel.application.service;

import com.example.image2excel.domain.model.CellRange;
import com.example.image2excel.domain.model.ChannelMapper;
import com.example.image2excel.domain.model.ColorChannel;
import com.example.image2excel.domain.model.GradientRule;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the black-to-channel color scale rules and the cell ranges each one covers.
 */
@Service
public class GradientRuleGenerator {

	/**
	 * Generates one rule per channel for a grid of the given size.
	 * Every column of a channel becomes its own single-column range spanning all rows; columns
	 * of the same channel are never adjacent, so they are not merged. Channels without columns
	 * (grids narrower than three columns) get no rule.
	 *
	 * @param gridWidth  number of grid columns
	 * @param gridHeight number of grid rows
	 * @return rules in channel order, at most three
	 */
    public List<GradientRule> generate(int gridWidth, int gridHeight) {
        if (gridWidth < 0 || gridHeight < 1) {
            throw new IllegalArgumentException("Invalid grid size: " + gridWidth + " x " + gridHeight);
        }

        Map<ColorChannel, List<CellRange>> rangesByChannel = new EnumMap<>(ColorChannel.class);
        for (ColorChannel channel : ColorChannel.values()) {
            rangesByChannel.put(channel, new ArrayList<>());
        }
        for (int column = 0; column < gridWidth; column++) {
            rangesByChannel.get(ChannelMapper.channel(column)).add(CellRange.column(column + 1, gridHeight));
        }

        List<GradientRule> rules = new ArrayList<>(ColorChannel.COUNT);
        rangesByChannel.forEach((channel, ranges) -> {
            if (!ranges.isEmpty()) {
                rules.add(new GradientRule(channel, ranges));
            }
        });
        return rules;
    }
}
