package com.github.musiKk.torque.ast;

// members carry no sigil, hence a plain ident instead of a Name
public record Member(String ident, Expression value) implements Comparable<Member> {

    @Override
    public int compareTo(Member other) {
        return AstOrder.MEMBER.compare(this, other);
    }

}
