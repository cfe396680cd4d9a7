package dev.tabsuite.formatter.block;

import dev.tabsuite.formatter.model.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Alignment scope owning its direct statements and nested blocks in source order.
 * Header and footer statements render one level above the body.
 */
public record Block(BlockKind kind, Optional<Statement> header, List<BlockElement> body,
                    Optional<Statement> footer, int level) implements BlockElement {

    public Block {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(footer, "footer");
        if (level < 0) {
            throw new IllegalArgumentException("level must be zero or greater");
        }
        for (BlockElement element : body) {
            if (!(element instanceof Statement) && !(element instanceof Block)) {
                throw new IllegalArgumentException("Unsupported block element: " + element);
            }
        }
        body = List.copyOf(body);
    }

    public static Block of(BlockKind kind, int level, List<BlockElement> body) {
        return new Block(kind, Optional.empty(), body, Optional.empty(), level);
    }

    /**
     * Statements directly owned by this block, excluding nested blocks and their headers.
     */
    public List<Statement> statements() {
        return statementsOf(body);
    }

    /**
     * Statements among the elements, skipping nested blocks.
     */
    public static List<Statement> statementsOf(List<BlockElement> elements) {
        List<Statement> statements = new ArrayList<>();
        for (BlockElement element : elements) {
            if (element instanceof Statement statement) {
                statements.add(statement);
            }
        }
        return statements;
    }

    public List<Block> children() {
        List<Block> children = new ArrayList<>();
        for (BlockElement element : body) {
            if (element instanceof Block child) {
                children.add(child);
            }
        }
        return children;
    }
}
