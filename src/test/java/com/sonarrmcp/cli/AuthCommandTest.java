package com.sonarrmcp.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.jasypt.encryption.StringEncryptor;
import org.jasypt.exceptions.EncryptionInitializationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuthCommandTest {

    @Mock
    private StringEncryptor stringEncryptor;

    @InjectMocks
    private AuthCommand authCommand;

    @Test
    void encryptKey_shouldWrapTheCipherText() {
        when(stringEncryptor.encrypt("0123456789abcdef")).thenReturn("c2VjcmV0");

        String output = authCommand.encryptKey("  0123456789abcdef ");

        assertThat(output).isEqualTo("\u001B[32mENC(c2VjcmV0)\u001B[0m");
    }

    @Test
    void encryptKey_blankValue_shouldBeRejected() {
        assertThat(authCommand.encryptKey("   ")).contains("must not be blank");
        verifyNoInteractions(stringEncryptor);
    }

    @Test
    void encryptKey_missingPassword_shouldExplainTheFailure() {
        when(stringEncryptor.encrypt("key"))
                .thenThrow(new EncryptionInitializationException("Password not set"));

        assertThat(authCommand.encryptKey("key"))
                .startsWith("\u001B[31m")
                .contains("is JASYPT_ENCRYPTOR_PASSWORD set?")
                .contains("Password not set");
    }
}
