package com.insightpulse.kgengine.util;

import com.insightpulse.kgengine.exception.StoreException;
import org.springframework.dao.DataAccessException;

import java.util.function.Supplier;

/**
 * Translates data-access failures on read paths into {@link StoreException}.
 */
public final class StoreCalls {

    private StoreCalls() {
    }

    public static <T> T read(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new StoreException("Store read failed: " + operation, e);
        }
    }
}
