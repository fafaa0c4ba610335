package com.tasklens.observability;

import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.WriteListener;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpServletResponseWrapper;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.Charset;

/**
 * Pass-through response wrapper that counts body bytes as they are written. Nothing is
 * buffered, so the body and its timing are exactly what the handler produced.
 */
class ByteCountingResponseWrapper extends HttpServletResponseWrapper {

    private CountingOutputStream outputStream;
    private PrintWriter writer;

    ByteCountingResponseWrapper(HttpServletResponse response) {
        super(response);
    }

    @Override
    public ServletOutputStream getOutputStream() throws IOException {
        if (writer != null) {
            throw new IllegalStateException("getWriter() has already been called on this response");
        }
        if (outputStream == null) {
            outputStream = new CountingOutputStream(super.getOutputStream());
        }
        return outputStream;
    }

    @Override
    public PrintWriter getWriter() throws IOException {
        if (writer == null) {
            if (outputStream != null) {
                throw new IllegalStateException("getOutputStream() has already been called on this response");
            }
            outputStream = new CountingOutputStream(super.getOutputStream());
            Charset charset = Charset.forName(getCharacterEncoding());
            writer = new PrintWriter(new OutputStreamWriter(outputStream, charset));
        }
        return writer;
    }

    @Override
    public void flushBuffer() throws IOException {
        if (writer != null) {
            writer.flush();
        }
        super.flushBuffer();
    }

    /**
     * Pushes characters buffered in the writer down to the counted stream. Commits the
     * response, so only call it once the handler chain has completed normally.
     */
    void flushWriter() {
        if (writer != null) {
            writer.flush();
        }
    }

    /**
     * Bytes that have reached the underlying stream. Characters still buffered in the writer
     * are not counted until {@link #flushWriter()}.
     */
    long getByteCount() {
        return outputStream != null ? outputStream.count : 0;
    }

    private static final class CountingOutputStream extends ServletOutputStream {

        private final ServletOutputStream delegate;
        private long count;

        CountingOutputStream(ServletOutputStream delegate) {
            this.delegate = delegate;
        }

        @Override
        public void write(int b) throws IOException {
            delegate.write(b);
            count++;
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            delegate.write(b, off, len);
            count += len;
        }

        @Override
        public void flush() throws IOException {
            delegate.flush();
        }

        @Override
        public void close() throws IOException {
            delegate.close();
        }

        @Override
        public boolean isReady() {
            return delegate.isReady();
        }

        @Override
        public void setWriteListener(WriteListener listener) {
            delegate.setWriteListener(listener);
        }
    }
}
