package org.javai.tryagain.boundary;

import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.*;

class TransientExceptionsTest {

    @Test
    void networkTimeoutsAndRefusals_areTransient() {
        assertThat(TransientExceptions.isTransient(new SocketTimeoutException())).isTrue();
        assertThat(TransientExceptions.isTransient(new HttpTimeoutException("slow"))).isTrue();
        assertThat(TransientExceptions.isTransient(new ConnectException())).isTrue();
        assertThat(TransientExceptions.isTransient(new TimeoutException())).isTrue();
    }

    @Test
    void unknownHost_isPermanent() {
        assertThat(TransientExceptions.isTransient(new UnknownHostException("nowhere.invalid"))).isFalse();
    }

    @Test
    void fileSystemProblems_arePermanent() {
        assertThat(TransientExceptions.isTransient(new FileNotFoundException())).isFalse();
        assertThat(TransientExceptions.isTransient(new NoSuchFileException("/tmp/x"))).isFalse();
        assertThat(TransientExceptions.isTransient(new AccessDeniedException("/tmp/x"))).isFalse();
    }

    @Test
    void otherIoExceptions_areTransient() {
        assertThat(TransientExceptions.isTransient(new IOException("connection reset"))).isTrue();
    }

    @Test
    void sqlExceptions_dependOnKindAndState() {
        assertThat(TransientExceptions.isTransient(new SQLTransientConnectionException("pool exhausted"))).isTrue();
        assertThat(TransientExceptions.isTransient(new SQLException("link failure", "08S01"))).isTrue();
        assertThat(TransientExceptions.isTransient(new SQLException("syntax error", "42000"))).isFalse();
        assertThat(TransientExceptions.isTransient(new SQLException("no state"))).isFalse();
    }

    @Test
    void everythingElse_isPermanent() {
        assertThat(TransientExceptions.isTransient(new InterruptedException())).isFalse();
        assertThat(TransientExceptions.isTransient(new IllegalStateException())).isFalse();
    }
}
