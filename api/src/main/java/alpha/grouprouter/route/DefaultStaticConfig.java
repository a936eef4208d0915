package alpha.grouprouter.route;

import alpha.grouprouter.util.AbstractImmutableBuilder;

import java.time.Duration;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link StaticConfig}.
 */
final class DefaultStaticConfig implements StaticConfig {
    private final Builder  builder;
    private final String   index;
    private final boolean  browse,
                           download,
                           byteRange,
                           compress;
    private final Duration maxAge;
    
    DefaultStaticConfig(Builder b, DefaultBuilder.MutableState s) {
        builder   = b;
        index     = s.index;
        browse    = s.browse;
        download  = s.download;
        byteRange = s.byteRange;
        compress  = s.compress;
        maxAge    = s.maxAge;
    }
    
    @Override
    public String index() {
        return index;
    }
    
    @Override
    public boolean browse() {
        return browse;
    }
    
    @Override
    public boolean download() {
        return download;
    }
    
    @Override
    public boolean byteRange() {
        return byteRange;
    }
    
    @Override
    public boolean compress() {
        return compress;
    }
    
    @Override
    public Duration maxAge() {
        return maxAge;
    }
    
    @Override
    public Builder toBuilder() {
        return builder;
    }
    
    @Override
    public String toString() {
        return "StaticConfig{index=" + index +
               ", browse=" + browse +
               ", download=" + download +
               ", byteRange=" + byteRange +
               ", compress=" + compress +
               ", maxAge=" + maxAge + '}';
    }
    
    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();
        
        static class MutableState {
            String   index     = "index.html";
            boolean  browse    = false,
                     download  = false,
                     byteRange = false,
                     compress  = false;
            Duration maxAge    = Duration.ZERO;
        }
        
        private DefaultBuilder() {
            // super()
        }
        
        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }
        
        @Override
        public Builder index(String newVal) {
            if (newVal.isBlank()) {
                throw new IllegalArgumentException("Index is blank.");
            }
            return new DefaultBuilder(this, s -> s.index = newVal);
        }
        
        @Override
        public Builder browse(boolean newVal) {
            return new DefaultBuilder(this, s -> s.browse = newVal);
        }
        
        @Override
        public Builder download(boolean newVal) {
            return new DefaultBuilder(this, s -> s.download = newVal);
        }
        
        @Override
        public Builder byteRange(boolean newVal) {
            return new DefaultBuilder(this, s -> s.byteRange = newVal);
        }
        
        @Override
        public Builder compress(boolean newVal) {
            return new DefaultBuilder(this, s -> s.compress = newVal);
        }
        
        @Override
        public Builder maxAge(Duration newVal) {
            if (requireNonNull(newVal).isNegative()) {
                throw new IllegalArgumentException("Negative max age: " + newVal);
            }
            return new DefaultBuilder(this, s -> s.maxAge = newVal);
        }
        
        @Override
        public StaticConfig build() {
            return new DefaultStaticConfig(this, constructState(MutableState::new));
        }
    }
}
