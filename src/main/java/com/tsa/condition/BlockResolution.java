package com.tsa.condition;

import java.util.List;
import java.util.Map;

/**
 * Output of {@link BlockResolver}.
 *
 * @param blocks        Unique blocks sorted by alias
 * @param blocksByToken Block bound to each block-like token, keyed by token index
 * @param failed        Whether any operand could not be resolved
 */
public record BlockResolution(List<Block> blocks, Map<Integer, Block> blocksByToken, boolean failed) {

    public BlockResolution {
        blocks = List.copyOf(blocks);
        blocksByToken = Map.copyOf(blocksByToken);
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }
}
