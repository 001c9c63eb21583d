package io.github.manjago.switchboard.command;

import io.github.manjago.switchboard.option.Option;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Chain of groups walked by the router, starting below the root.
 * 
 * When routing fails this is the partial path: the deepest group reached.
 */
public final class GroupPath {
    
    private final CommandGroup root;
    private final List<CommandGroup> groups;
    
    private GroupPath(CommandGroup root, List<CommandGroup> groups) {
        this.root = root;
        this.groups = List.copyOf(groups);
    }
    
    public static GroupPath of(CommandGroup root) {
        return new GroupPath(root, List.of());
    }
    
    public @NotNull CommandGroup root() {
        return root;
    }
    
    /**
     * @return groups traversed below the root, outermost first
     */
    public @NotNull List<CommandGroup> groups() {
        return groups;
    }
    
    /**
     * @return deepest group reached (the root if none was traversed)
     */
    public @NotNull CommandGroup bottom() {
        return groups.isEmpty() ? root : groups.get(groups.size() - 1);
    }
    
    public GroupPath append(CommandGroup group) {
        List<CommandGroup> next = new ArrayList<>(groups);
        next.add(group);
        return new GroupPath(root, next);
    }
    
    /**
     * Terminate this path at a command.
     * 
     * Visible options: the command's own, then each group's shared options
     * from the innermost out, then the root's (global) options.
     */
    public CommandPath resolve(Command command) {
        List<Option> visible = new ArrayList<>(command.options());
        for (int i = groups.size() - 1; i >= 0; i--) {
            visible.addAll(groups.get(i).sharedOptions());
        }
        visible.addAll(root.sharedOptions());
        return new CommandPath(this, command, visible);
    }
    
    /**
     * @return names of the traversed groups
     */
    public List<String> names() {
        return groups.stream().map(CommandGroup::name).toList();
    }
    
    /**
     * Invocation prefix, e.g. {@code tool test}.
     */
    public String invocation() {
        StringBuilder sb = new StringBuilder(root.name());
        for (CommandGroup group : groups) {
            sb.append(' ').append(group.name());
        }
        return sb.toString();
    }
    
    @Override
    public String toString() {
        return "GroupPath" + names();
    }
}
