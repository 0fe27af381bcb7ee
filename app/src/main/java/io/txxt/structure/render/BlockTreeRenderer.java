package io.txxt.structure.render;

import io.txxt.structure.block.Block;
import io.txxt.structure.block.BlockKind;
import io.txxt.structure.block.Container;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Renders a block tree as indented text, one block per line: kind, one-based line range, container kind and summary.
 */
public class BlockTreeRenderer {

    private static final String STEP = "  ";
    private static final int SUMMARY_LIMIT = 60;

    public String render(Block root) {
        StringBuilder out = new StringBuilder();
        Deque<Frame> pending = new ArrayDeque<>();
        pending.push(new Frame(root, 0));
        while (!pending.isEmpty()) {
            Frame frame = pending.pop();
            appendLine(out, frame.block(), frame.depth());
            List<Block> children = frame.block().children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(new Frame(children.get(i), frame.depth() + 1));
            }
        }
        return out.toString();
    }

    private static void appendLine(StringBuilder out, Block block, int depth) {
        out.append(STEP.repeat(depth)).append(block.kind().displayName());
        if (block.kind() != BlockKind.ROOT) {
            out.append(" [").append(block.lines().first() + 1).append('-').append(block.lines().last() + 1).append(']');
        }
        block.container().map(Container::kind).ifPresent(kind -> out.append(" <").append(kind.name().toLowerCase()).append('>'));
        String summary = abbreviate(block.type().summary());
        if (!summary.isEmpty()) {
            out.append(' ').append('"').append(summary).append('"');
        }
        out.append('\n');
    }

    private static String abbreviate(String text) {
        String flat = text.replace('\n', ' ');
        return flat.length() <= SUMMARY_LIMIT ? flat : flat.substring(0, SUMMARY_LIMIT - 3) + "...";
    }

    private record Frame(Block block, int depth) {
    }
}
