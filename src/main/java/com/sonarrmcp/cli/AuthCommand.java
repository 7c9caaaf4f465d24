package com.sonarrmcp.cli;

import com.sonarrmcp.dto.response.CommandResponse;
import org.jasypt.encryption.StringEncryptor;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * A Spring Shell component that helps keep the upstream API key out of plain-text configuration.
 */
@ShellComponent
public class AuthCommand {

    private final StringEncryptor stringEncryptor;

    public AuthCommand(StringEncryptor stringEncryptor) {
        this.stringEncryptor = stringEncryptor;
    }

    /**
     * Encrypts an API key with the Jasypt password of this process ({@code JASYPT_ENCRYPTOR_PASSWORD}).
     * The result can be used as {@code SONARR_API_KEY} or {@code mcp.upstream.api-key}.
     *
     * @param value The plain-text API key.
     * @return The {@code ENC(...)} value, or a red error message.
     */
    @ShellMethod(key = "encrypt-key", value = "Encrypt an API key for use in configuration.")
    public String encryptKey(@ShellOption(value = {"--value"}, help = "The plain-text API key.") String value) {
        if (value == null || value.isBlank()) {
            return CommandResponse.error("The API key must not be blank.").toAnsiString();
        }
        try {
            return CommandResponse.ok("ENC(" + stringEncryptor.encrypt(value.trim()) + ")").toAnsiString();
        } catch (RuntimeException e) {
            return CommandResponse.error("Encryption failed; is JASYPT_ENCRYPTOR_PASSWORD set? " + e.getMessage())
                    .toAnsiString();
        }
    }
}
