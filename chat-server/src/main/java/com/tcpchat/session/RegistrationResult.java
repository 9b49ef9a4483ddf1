package com.tcpchat.session;

/**
 * Outcome of {@link ConnectionRegistry#register}.
 */
public enum RegistrationResult {
    OK,
    USERNAME_TAKEN
}
