package org.javai.railway.boundary;

import org.javai.railway.Failure;
import org.javai.railway.FailureKind;
import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLTransientConnectionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.*;

class DefaultFailureClassifierTest {

    private final DefaultFailureClassifier classifier = new DefaultFailureClassifier();

    private FailureKind kindOf(Throwable t) {
        return classifier.classify("Op", t).kind();
    }

    @Test
    void classify_networkProblems_areServiceUnavailable() {
        assertThat(kindOf(new ConnectException("refused"))).isEqualTo(FailureKind.SERVICE_UNAVAILABLE);
        assertThat(kindOf(new UnknownHostException("nowhere"))).isEqualTo(FailureKind.SERVICE_UNAVAILABLE);
        assertThat(kindOf(new TimeoutException("slow"))).isEqualTo(FailureKind.SERVICE_UNAVAILABLE);
        assertThat(kindOf(new IOException("reset"))).isEqualTo(FailureKind.SERVICE_UNAVAILABLE);
    }

    @Test
    void classify_fileSystemProblems() {
        assertThat(kindOf(new FileNotFoundException("a.txt"))).isEqualTo(FailureKind.NOT_FOUND);
        assertThat(kindOf(new NoSuchFileException("b.txt"))).isEqualTo(FailureKind.NOT_FOUND);
        assertThat(kindOf(new AccessDeniedException("c.txt"))).isEqualTo(FailureKind.FORBIDDEN);
        assertThat(kindOf(new FileAlreadyExistsException("d.txt"))).isEqualTo(FailureKind.CONFLICT);
    }

    @Test
    void classify_sqlProblems() {
        assertThat(kindOf(new SQLTransientConnectionException("pool empty"))).isEqualTo(FailureKind.SERVICE_UNAVAILABLE);
        assertThat(kindOf(new SQLException("link down", "08S01"))).isEqualTo(FailureKind.SERVICE_UNAVAILABLE);
        assertThat(kindOf(new SQLIntegrityConstraintViolationException("duplicate key"))).isEqualTo(FailureKind.CONFLICT);
        assertThat(kindOf(new SQLException("syntax", "42000"))).isEqualTo(FailureKind.UNEXPECTED);
    }

    @Test
    void classify_unknownException_isUnexpectedWithClassName() {
        Failure failure = classifier.classify("Op", new Exception());

        assertThat(failure.kind()).isEqualTo(FailureKind.UNEXPECTED);
        assertThat(failure.message()).isEqualTo("java.lang.Exception");
        assertThat(failure.code()).isEqualTo("unknown.Exception");
        assertThat(failure.instance()).isEqualTo("Op");
    }
}
