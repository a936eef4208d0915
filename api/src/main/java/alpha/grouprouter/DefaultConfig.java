package alpha.grouprouter;

import alpha.grouprouter.HttpConstants.Method;
import alpha.grouprouter.handler.ErrorHandler;
import alpha.grouprouter.util.AbstractImmutableBuilder;
import alpha.grouprouter.util.Arrays;

import java.util.List;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Config}.
 */
final class DefaultConfig implements Config {
    private final Builder      builder;
    private final List<String> requestMethods;
    private final ErrorHandler errorHandler;
    
    DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder        = b;
        requestMethods = s.requestMethods;
        errorHandler   = s.errorHandler;
    }
    
    @Override
    public List<String> requestMethods() {
        return requestMethods;
    }
    
    @Override
    public ErrorHandler errorHandler() {
        return errorHandler;
    }
    
    @Override
    public Builder toBuilder() {
        return builder;
    }
    
    @Override
    public String toString() {
        return "Config{requestMethods=" + requestMethods + '}';
    }
    
    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();
        
        static class MutableState {
            List<String> requestMethods = Method.ALL;
            ErrorHandler errorHandler   = ErrorHandler.BASE;
        }
        
        private DefaultBuilder() {
            // super()
        }
        
        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }
        
        @Override
        public Builder requestMethods(String first, String... more) {
            return requestMethods(Arrays.listOf(first, more));
        }
        
        @Override
        public Builder requestMethods(List<String> newVal) {
            var copy = List.copyOf(newVal);
            if (copy.isEmpty()) {
                throw new IllegalArgumentException("No request methods.");
            }
            return new DefaultBuilder(this, s -> s.requestMethods = copy);
        }
        
        @Override
        public Builder errorHandler(ErrorHandler newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.errorHandler = newVal);
        }
        
        @Override
        public Config build() {
            return new DefaultConfig(this, constructState(MutableState::new));
        }
    }
}
