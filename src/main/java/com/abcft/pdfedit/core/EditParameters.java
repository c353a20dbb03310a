package com.abcft.pdfedit.core;

import com.abcft.pdfedit.core.util.MapUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * Parameters shared by the editing components.
 */
public abstract class EditParameters {

    public abstract static class Builder<T extends EditParameters> {

        int startPageIndex = 0;
        int endPageIndex = Integer.MAX_VALUE;
        boolean debug;
        final Map<String, Object> meta = new HashMap<>();

        public Builder() {
        }

        public Builder(Map<String, String> params) {
            this.startPageIndex = MapUtils.getInt(params, "startPage", 1) - 1;
            this.endPageIndex = MapUtils.getInt(params, "endPage", Integer.MAX_VALUE);
            if (this.endPageIndex != Integer.MAX_VALUE) {
                this.endPageIndex -= 1;
            }
            this.debug = MapUtils.getBoolean(params, "debug", debug);
        }

        /**
         * Sets the page index to process.
         *
         * @param pageIndex the index of the page (0-based) to process.
         * @return this builder.
         */
        public Builder<T> setPageIndex(int pageIndex) {
            this.startPageIndex = pageIndex;
            this.endPageIndex = pageIndex;
            return this;
        }

        /**
         * Sets the start page index to process.
         *
         * Default value is 0.
         *
         * @param startPageIndex the index of the first page (0-based) to process.
         * @return this builder.
         */
        public Builder<T> setStartPageIndex(int startPageIndex) {
            this.startPageIndex = startPageIndex;
            return this;
        }

        /**
         * Sets the last page index to process.
         *
         * Default value is {@value Integer#MAX_VALUE}.
         *
         * @param endPageIndex the index of the last page (0-based) to process.
         * @return this builder.
         */
        public Builder<T> setEndPageIndex(int endPageIndex) {
            this.endPageIndex = endPageIndex;
            return this;
        }

        public Builder<T> setDebug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder<T> addMeta(String key, Object value) {
            this.meta.put(key, value);
            return this;
        }

        public Builder<T> addMetas(Map<String, Object> metas) {
            if (metas != null) {
                this.meta.putAll(metas);
            }
            return this;
        }

        /**
         * Build a new instance of parameters.
         *
         * @return the new instance of parameters.
         */
        public abstract T build();
    }

    protected EditParameters(Builder<?> builder) {
        this.startPageIndex = builder.startPageIndex;
        this.endPageIndex = builder.endPageIndex;
        this.debug = builder.debug;
        this.meta = new HashMap<>(builder.meta);
    }

    /**
     * Populates the builder with current parameters.
     * @param builder the builder to populate with.
     */
    protected <B extends Builder<?>> B buildUpon(B builder) {
        builder.setDebug(debug)
                .setStartPageIndex(startPageIndex)
                .setEndPageIndex(endPageIndex)
                .addMetas(meta);
        return builder;
    }

    public boolean containsPage(int pageIndex) {
        return this.startPageIndex <= pageIndex && pageIndex <= this.endPageIndex;
    }

    /**
     * Create a the builder with current parameters.
     *
     * @return a new builder with current parameters.
     */
    public abstract Builder<?> buildUpon();

    /**
     * Debug mode.
     */
    public final boolean debug;
    /**
     * Index (zero-based) of the first page to process.
     */
    public final int startPageIndex;
    /**
     * Index (zero-based) of the last page to process.
     */
    public final int endPageIndex;
    /**
     * Free-form values attached by the host.
     */
    public final Map<String, Object> meta;

}
