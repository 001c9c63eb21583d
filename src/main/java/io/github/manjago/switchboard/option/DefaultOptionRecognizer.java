package io.github.manjago.switchboard.option;

import io.github.manjago.switchboard.core.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single left-to-right scan over the stream.
 * 
 * <ul>
 *   <li>non-option token: skipped, stays positional</li>
 *   <li>flag: consumed, set to true</li>
 *   <li>keyed option: consumes itself and the next token as its value;
 *       the next token must exist and must not look like an option</li>
 * </ul>
 * Option groups are checked once the scan completes.
 */
public class DefaultOptionRecognizer implements OptionRecognizer {
    
    private static final Logger log = LoggerFactory.getLogger(DefaultOptionRecognizer.class);
    
    @Override
    public OptionValues recognize(OptionRegistry registry, TokenStream stream) throws OptionException {
        OptionValues values = new OptionValues();
        
        int i = 0;
        while (i < stream.size()) {
            String token = stream.get(i);
            if (!Option.isOptionToken(token)) {
                i++;
                continue;
            }
            
            Option option = registry.lookup(token);
            if (option == null) {
                throw OptionException.unrecognizedOption(token);
            }
            
            if (option instanceof Flag flag) {
                stream.remove(i);
                values.setFlag(flag);
                log.debug("Flag {} set", token);
            } else if (option instanceof KeyedOption<?> keyed) {
                if (i + 1 >= stream.size() || Option.isOptionToken(stream.get(i + 1))) {
                    throw OptionException.expectedValue(token);
                }
                String raw = stream.get(i + 1);
                bind(values, keyed, raw);
                stream.remove(i + 1);
                stream.remove(i);
                log.debug("Option {} = '{}'", token, raw);
            }
        }
        
        for (OptionGroup group : registry.groups()) {
            if (!group.isSatisfiedBy(values.present())) {
                throw OptionException.groupMisuse(group);
            }
        }
        
        return values;
    }
    
    private static <T> void bind(OptionValues values, KeyedOption<T> option, String raw) throws OptionException {
        values.setValue(option, option.convert(raw));
    }
}
