package com.unocalc.controller;

import com.unocalc.ErrorKind;

/**
 * Receives the errors a key press produced, so the front end can show them to the user.
 */
public interface ErrorListener {

    void onError(ErrorKind kind, String message);
}
