package io.github.yok.flexschemasync.model;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * The assembled push script: one fragment per reconciled table, in execution order.
 *
 * <p>
 * Instances are immutable; {@link #append(ScriptFragment)} returns a new script.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@EqualsAndHashCode
public class PushScript {

    private static final PushScript EMPTY = new PushScript(ImmutableList.of());

    @Getter
    private final ImmutableList<ScriptFragment> fragments;

    private PushScript(ImmutableList<ScriptFragment> fragments) {
        this.fragments = fragments;
    }

    /**
     * Returns the script without fragments.
     *
     * @return empty script
     */
    public static PushScript empty() {
        return EMPTY;
    }

    /**
     * Creates a script from fragments in execution order.
     *
     * @param fragments fragments
     * @return script
     */
    public static PushScript of(List<ScriptFragment> fragments) {
        return new PushScript(ImmutableList.copyOf(fragments));
    }

    /**
     * Returns a script with the given fragment added at the end.
     *
     * @param fragment fragment to add
     * @return new script
     */
    public PushScript append(ScriptFragment fragment) {
        return new PushScript(ImmutableList.<ScriptFragment>builderWithExpectedSize(
                fragments.size() + 1).addAll(fragments).add(fragment).build());
    }

    /**
     * Returns the executable text: every fragment rendered and concatenated.
     *
     * @return script text
     */
    public String getText() {
        StringBuilder sb = new StringBuilder();
        for (ScriptFragment fragment : fragments) {
            sb.append(fragment.render());
        }
        return sb.toString();
    }

    /**
     * Returns whether executing the script would change anything.
     *
     * @return {@code true} when every fragment is blank
     */
    public boolean isBlank() {
        return fragments.stream().allMatch(ScriptFragment::isBlank);
    }

    /**
     * Counts the fragments of the given kind.
     *
     * @param kind fragment kind
     * @return number of fragments
     */
    public long count(FragmentKind kind) {
        return fragments.stream().filter(f -> f.getKind() == kind).count();
    }

    @Override
    public String toString() {
        return getText();
    }
}
