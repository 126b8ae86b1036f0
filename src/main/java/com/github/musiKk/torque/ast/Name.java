package com.github.musiKk.torque.ast;

/**
 * A variable name. The identifier never carries the sigil; the variant does.
 */
public sealed interface Name extends Comparable<Name> {

    String ident();

    Kind kind();

    <R> R accept(Visitor<R> visitor);

    default char sigil() {
        return kind().sigil;
    }

    @Override
    default int compareTo(Name other) {
        return AstOrder.NAME.compare(this, other);
    }

    enum Kind {
        LOCAL('%'),
        GLOBAL('$');

        private final char sigil;

        Kind(char sigil) {
            this.sigil = sigil;
        }
    }

    interface Visitor<R> {
        R visitLocal(Local local);
        R visitGlobal(Global global);
    }

    record Local(String ident) implements Name {
        public Kind kind() { return Kind.LOCAL; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitLocal(this); }
    }

    record Global(String ident) implements Name {
        public Kind kind() { return Kind.GLOBAL; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visitGlobal(this); }
    }

}
