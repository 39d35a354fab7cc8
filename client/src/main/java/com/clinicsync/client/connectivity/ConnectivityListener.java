package com.clinicsync.client.connectivity;

import com.clinicsync.core.model.ConnectivityState;

/**
 * Callback for real connectivity transitions.
 */
@FunctionalInterface
public interface ConnectivityListener {
    void onChange(ConnectivityState state);
}
