package com.cropchain.trackingservice.repository;

import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.StatusCode;

/**
 * Classifies failures coming back from Firestore futures.
 */
public final class FirestoreErrors {

    private FirestoreErrors() {
    }

    /**
     * True when the failure, or any of its causes, says a document with the written id already
     * exists.
     */
    public static boolean isAlreadyExists(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ApiException
                    && ((ApiException) t).getStatusCode().getCode() == StatusCode.Code.ALREADY_EXISTS) {
                return true;
            }
        }
        return false;
    }
}
