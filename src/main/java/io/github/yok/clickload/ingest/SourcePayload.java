package io.github.yok.clickload.ingest;

import io.github.yok.clickload.parser.DataFormat;
import lombok.Getter;

/**
 * What an {@link Ingestor} hands back for one source locator.
 *
 * <ul>
 * <li>{@link TabularContent}: raw delimited bytes, parsed, reconciled and coerced in-process, then
 * bulk-inserted.</li>
 * <li>{@link StoreSideLoad}: a statement the store executes to read the source by itself.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public abstract class SourcePayload {

    /**
     * Payload variants.
     */
    public enum Kind {
        TABULAR_CONTENT, STORE_SIDE_LOAD
    }

    private final String locator;

    SourcePayload(String locator) {
        this.locator = locator;
    }

    public abstract Kind getKind();

    public static TabularContent tabular(String locator, byte[] content, DataFormat format) {
        return new TabularContent(locator, content, format);
    }

    public static StoreSideLoad storeSide(String locator, String statement) {
        return new StoreSideLoad(locator, statement);
    }

    /**
     * Raw delimited content of one source.
     */
    @Getter
    public static final class TabularContent extends SourcePayload {
        private final byte[] content;
        private final DataFormat format;

        TabularContent(String locator, byte[] content, DataFormat format) {
            super(locator);
            this.content = content;
            this.format = format;
        }

        @Override
        public Kind getKind() {
            return Kind.TABULAR_CONTENT;
        }
    }

    /**
     * Statement that makes the store load the source itself.
     */
    @Getter
    public static final class StoreSideLoad extends SourcePayload {
        private final String statement;

        StoreSideLoad(String locator, String statement) {
            super(locator);
            this.statement = statement;
        }

        @Override
        public Kind getKind() {
            return Kind.STORE_SIDE_LOAD;
        }
    }
}
