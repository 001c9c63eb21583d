package io.github.manjago.switchboard.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits short-flag clusters: {@code -xyz} becomes {@code -x -y -z}.
 * 
 * Only single-dash tokens made of two or more letters are split, so
 * {@code --long}, {@code -}, {@code --} and negative numbers pass through.
 * The splitter does not know which flags are declared; unknown letters
 * are left for the option recognizer to reject.
 * 
 * A cluster that directly follows a keyed-option spelling is that
 * option's value and is never split.
 */
public class ShortFlagSplitter implements StreamManipulator {
    
    private static final Pattern CLUSTER_PATTERN = Pattern.compile("^-[A-Za-z]{2,}$");
    
    private final Set<String> keyedSpellings;
    
    /**
     * Splitter that treats every cluster as flags.
     */
    public ShortFlagSplitter() {
        this(Set.of());
    }
    
    /**
     * @param keyedSpellings spellings of options that take a value
     */
    public ShortFlagSplitter(Set<String> keyedSpellings) {
        this.keyedSpellings = Set.copyOf(keyedSpellings);
    }
    
    @Override
    public void manipulate(TokenStream stream) {
        int i = 0;
        while (i < stream.size()) {
            String token = stream.get(i);
            boolean claimed = i > 0 && keyedSpellings.contains(stream.get(i - 1));
            if (!claimed && isCluster(token)) {
                List<String> flags = explode(token);
                stream.split(i, flags);
                i += flags.size();
            } else {
                i++;
            }
        }
    }
    
    static boolean isCluster(String token) {
        return CLUSTER_PATTERN.matcher(token).matches();
    }
    
    private static List<String> explode(String cluster) {
        List<String> flags = new ArrayList<>(cluster.length() - 1);
        for (int i = 1; i < cluster.length(); i++) {
            flags.add("-" + cluster.charAt(i));
        }
        return flags;
    }
}
