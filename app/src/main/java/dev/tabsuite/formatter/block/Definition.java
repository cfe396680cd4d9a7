package dev.tabsuite.formatter.block;

import dev.tabsuite.formatter.model.Line;
import dev.tabsuite.formatter.model.Statement;
import java.util.Objects;

/**
 * Test case, task or keyword: its name line and its body block.
 *
 * @param name     name line, kept verbatim
 * @param nameLine the same line cut into cells; data after the name is a first row of template arguments
 * @param body     body block
 */
public record Definition(Statement name, Line nameLine, Block body) {

    public Definition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(nameLine, "nameLine");
        Objects.requireNonNull(body, "body");
    }
}
