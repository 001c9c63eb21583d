package io.github.manjago.switchboard.help;

import io.github.manjago.switchboard.command.Command;
import io.github.manjago.switchboard.command.CommandGroup;
import io.github.manjago.switchboard.command.CommandPath;
import io.github.manjago.switchboard.command.GroupPath;
import io.github.manjago.switchboard.command.Routable;
import io.github.manjago.switchboard.option.KeyedOption;
import io.github.manjago.switchboard.option.Option;
import io.github.manjago.switchboard.option.OptionException;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain-text renderer with two-column listings.
 * 
 * <pre>
 * Usage: tool test &lt;command&gt; [options]
 * 
 * Groups:
 *   ...
 * Commands:
 *   unit            Runs unit tests
 * </pre>
 */
public class PlainHelpRenderer implements HelpRenderer {
    
    private static final int MIN_COLUMN = 16;
    
    @Override
    public String renderCommandList(GroupPath path) {
        CommandGroup group = path.bottom();
        StringBuilder sb = new StringBuilder();
        sb.append("\nUsage: ").append(path.invocation()).append(" <command> [options]\n");
        
        if (!group.description().isEmpty()) {
            sb.append('\n').append(group.description()).append('\n');
        }
        
        List<Routable> groups = new ArrayList<>();
        List<Routable> commands = new ArrayList<>();
        for (Routable child : group.children()) {
            if (child instanceof CommandGroup) {
                groups.add(child);
            } else {
                commands.add(child);
            }
        }
        
        int width = MIN_COLUMN;
        for (Routable child : group.children()) {
            width = Math.max(width, child.name().length() + 2);
        }
        
        if (!groups.isEmpty()) {
            sb.append("\nGroups:\n");
            for (Routable child : groups) {
                appendRow(sb, child.name(), child.description(), width);
            }
        }
        if (!commands.isEmpty()) {
            sb.append("\nCommands:\n");
            for (Routable child : commands) {
                appendRow(sb, child.name(), child.description(), width);
            }
        }
        return sb.toString();
    }
    
    @Override
    public String renderUsage(CommandPath path) {
        Command command = path.command();
        StringBuilder sb = new StringBuilder();
        sb.append("\nUsage: ").append(path.usage()).append('\n');
        
        if (!command.description().isEmpty()) {
            sb.append('\n').append(command.description()).append('\n');
        }
        
        List<Option> options = path.visibleOptions();
        if (!options.isEmpty()) {
            List<String> labels = new ArrayList<>();
            int width = MIN_COLUMN;
            for (Option option : options) {
                String label = label(option);
                labels.add(label);
                width = Math.max(width, label.length() + 2);
            }
            
            sb.append("\nOptions:\n");
            for (int i = 0; i < options.size(); i++) {
                appendRow(sb, labels.get(i), options.get(i).description(), width);
            }
        }
        return sb.toString();
    }
    
    @Override
    public String renderMisusedOptions(CommandPath path, OptionException error) {
        return renderUsage(path) + "\n" + error.getMessage() + "\n";
    }
    
    private static String label(Option option) {
        String label = String.join(", ", option.names());
        if (option instanceof KeyedOption<?> keyed) {
            label += " <" + keyed.type().name() + ">";
        }
        return label;
    }
    
    private static void appendRow(StringBuilder sb, String left, String right, int width) {
        sb.append("  ").append(left);
        if (!right.isEmpty()) {
            sb.append(" ".repeat(width - left.length())).append(right);
        }
        sb.append('\n');
    }
}
