package xyz.vvrf.reactor.flow.core;

import java.util.Objects;

/**
 * 按字符串标签命名的动作，按标签判等。
 */
final class NamedAction implements Action {

    private final String label;

    NamedAction(String label) {
        this.label = Objects.requireNonNull(label, "动作标签不能为空");
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return label.equals(((NamedAction) o).label);
    }

    @Override
    public int hashCode() {
        return label.hashCode();
    }

    @Override
    public String toString() {
        return label;
    }
}
