package org.ebaysf.tidepool.util;

import com.google.common.base.Charsets;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Gson setup shared by size estimation.
 */
public abstract class Gsons {

    public static final Gson GSON = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    /**
     * @return UTF-8 length of the value serialized as JSON
     */
    public static long estimateByteSize(final Object value) {

        return GSON.toJson(value).getBytes(Charsets.UTF_8).length;
    }
}
