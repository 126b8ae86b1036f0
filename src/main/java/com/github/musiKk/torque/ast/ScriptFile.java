package com.github.musiKk.torque.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A whole TorqueScript file. Statements and definitions share one list so the
 * interleaving of the source survives.
 */
public record ScriptFile(List<Either<Statement, Definition>> entries) implements Comparable<ScriptFile> {

    public ScriptFile {
        entries = List.copyOf(entries);
    }

    public static ScriptFile empty() {
        return new ScriptFile(List.of());
    }

    public List<Statement> statements() {
        List<Statement> statements = new ArrayList<>();
        entries.forEach(e -> e.fold(statements::add, d -> false));
        return List.copyOf(statements);
    }

    public List<Definition> definitions() {
        List<Definition> definitions = new ArrayList<>();
        entries.forEach(e -> e.fold(s -> false, definitions::add));
        return List.copyOf(definitions);
    }

    @Override
    public int compareTo(ScriptFile other) {
        return AstOrder.FILE.compare(this, other);
    }

}
