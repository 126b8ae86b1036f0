package com.github.musiKk.torque.check;

import java.util.List;
import java.util.stream.Collectors;

public class IllegalTreeException extends RuntimeException {

    private final List<Violation> violations;

    public IllegalTreeException(List<Violation> violations) {
        super(violations.size() + " violation(s)\n" + violations.stream()
                .map(Violation::message)
                .collect(Collectors.joining("\n")));
        this.violations = List.copyOf(violations);
    }

    public List<Violation> violations() {
        return violations;
    }

}
