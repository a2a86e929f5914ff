/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelight.servlet;

import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Holds the request body in memory, so that it can be read here and still be read again,
 * unchanged, by the servlet.
 */
final class BufferedBodyRequest extends HttpServletRequestWrapper {
  static BufferedBodyRequest create(HttpServletRequest request) throws IOException {
    ServletInputStream in = request.getInputStream();
    byte[] body = in != null ? in.readAllBytes() : new byte[0];
    return new BufferedBodyRequest(request, body);
  }

  final byte[] body;

  BufferedBodyRequest(HttpServletRequest request, byte[] body) {
    super(request);
    this.body = body;
  }

  byte[] body() {
    return body;
  }

  @Override public ServletInputStream getInputStream() {
    return new ByteArrayServletInputStream(body);
  }

  @Override public BufferedReader getReader() {
    String encoding = getCharacterEncoding();
    Charset charset = encoding != null ? Charset.forName(encoding) : StandardCharsets.UTF_8;
    return new BufferedReader(new InputStreamReader(getInputStream(), charset));
  }

  @Override public int getContentLength() {
    return body.length;
  }

  @Override public long getContentLengthLong() {
    return body.length;
  }

  static final class ByteArrayServletInputStream extends ServletInputStream {
    final ByteArrayInputStream delegate;

    ByteArrayServletInputStream(byte[] bytes) {
      this.delegate = new ByteArrayInputStream(bytes);
    }

    @Override public int read() {
      return delegate.read();
    }

    @Override public int read(byte[] b, int off, int len) {
      return delegate.read(b, off, len);
    }

    @Override public int available() {
      return delegate.available();
    }

    @Override public boolean isFinished() {
      return delegate.available() == 0;
    }

    @Override public boolean isReady() {
      return true;
    }

    /** The body is already in memory, so the listener is notified immediately. */
    @Override public void setReadListener(ReadListener listener) {
      if (listener == null) throw new NullPointerException("listener == null");
      try {
        if (!isFinished()) listener.onDataAvailable();
        listener.onAllDataRead();
      } catch (IOException e) {
        listener.onError(e);
      }
    }
  }
}
