package io.txxt.structure.block;

import io.txxt.structure.token.Token;
import io.txxt.structure.tree.TokenBlock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a segmented token tree into classified blocks, bottom-up. Consecutive list items become one list and
 * every block with children receives the container its type calls for.
 */
public class BlockAssembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(BlockAssembler.class);

    private final BlockClassifier classifier;

    public BlockAssembler() {
        this(new BlockClassifier());
    }

    public BlockAssembler(BlockClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    /**
     * @throws ContainerInvariantException when a session ends up under a block that only holds content
     */
    public Block assemble(TokenBlock root) {
        Objects.requireNonNull(root, "root");
        Map<TokenBlock, Block> assembled = new IdentityHashMap<>();
        for (TokenBlock block : postOrder(root)) {
            List<Block> children = new ArrayList<>(block.children().size());
            for (TokenBlock child : block.children()) {
                children.add(assembled.remove(child));
            }
            assembled.put(block, assembleOne(block, children));
        }
        Block result = assembled.get(root);
        LOGGER.debug("Assembled {} top-level blocks", result.children().size());
        return result;
    }

    private Block assembleOne(TokenBlock block, List<Block> children) {
        BlockType type = classifier.classify(block.tokens(), !children.isEmpty());
        List<Block> merged = mergeLists(children);
        Optional<Container> container = Optional.empty();
        if (!merged.isEmpty()) {
            Container target = containerFor(type.kind());
            merged.forEach(target::addChild);
            container = Optional.of(target);
        }
        return new Block(type, container, lineRange(block.tokens(), merged), block.indentLevel());
    }

    private static Container containerFor(BlockKind kind) {
        return switch (kind) {
            case ROOT, SESSION -> new SessionContainer();
            case BLANK_LINE, ANNOTATION, DEFINITION, VERBATIM, LIST_ITEM, LIST, PARAGRAPH -> new ContentContainer();
        };
    }

    private static List<Block> mergeLists(List<Block> children) {
        List<Block> merged = new ArrayList<>(children.size());
        List<Block> run = new ArrayList<>();
        for (Block child : children) {
            if (child.kind() == BlockKind.LIST_ITEM && (run.isEmpty() || run.get(0).indentLevel() == child.indentLevel())) {
                run.add(child);
                continue;
            }
            flushRun(run, merged);
            if (child.kind() == BlockKind.LIST_ITEM) {
                run.add(child);
            } else {
                merged.add(child);
            }
        }
        flushRun(run, merged);
        return merged;
    }

    private static void flushRun(List<Block> run, List<Block> merged) {
        if (run.isEmpty()) {
            return;
        }
        List<String> markers = new ArrayList<>(run.size());
        Container items = new ContentContainer();
        LineRange lines = run.get(0).lines();
        for (Block item : run) {
            markers.add(item.typeAs(BlockType.ListItem.class).marker().text());
            items.addChild(item);
            lines = lines.span(item.lines());
        }
        merged.add(new Block(new BlockType.ItemList(markers), Optional.of(items), lines, run.get(0).indentLevel()));
        run.clear();
    }

    private static LineRange lineRange(List<Token> tokens, List<Block> children) {
        LineRange range = null;
        if (!tokens.isEmpty()) {
            range = new LineRange(tokens.get(0).span().start().row(),
                    tokens.get(tokens.size() - 1).span().start().row());
        }
        for (Block child : children) {
            range = range == null ? child.lines() : range.span(child.lines());
        }
        return range == null ? new LineRange(0, 0) : range;
    }

    private static List<TokenBlock> postOrder(TokenBlock root) {
        List<TokenBlock> order = new ArrayList<>();
        Deque<TokenBlock> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            TokenBlock block = pending.pop();
            order.add(block);
            block.children().forEach(pending::push);
        }
        // parents were visited before their children; reversing puts every child ahead of its parent
        Collections.reverse(order);
        return order;
    }
}
