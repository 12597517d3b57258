/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ai.floedb.replicator.spi;

import java.util.List;

/** Root of every failure raised by the replication engine and its collaborators. */
public class ReplicationException extends RuntimeException {

  public ReplicationException(String msg) {
    super(msg);
  }

  public ReplicationException(String msg, Throwable cause) {
    super(msg, cause);
  }

  /** Misconfigured request, e.g. copying between tables that are not copy-compatible. */
  public static class ConfigurationException extends ReplicationException {
    public ConfigurationException(String msg) {
      super(msg);
    }
  }

  /** The service answered with a non-success status. Not retried. */
  public static class ServiceException extends ReplicationException {
    private final int statusCode;

    public ServiceException(String msg, int statusCode) {
      super(msg);
      this.statusCode = statusCode;
    }

    public ServiceException(String msg, int statusCode, Throwable cause) {
      super(msg, cause);
      this.statusCode = statusCode;
    }

    public int statusCode() {
      return statusCode;
    }
  }

  /** The call never got a service answer (network, credentials, client-side failure). */
  public static class TransportException extends ReplicationException {
    public TransportException(String msg, Throwable cause) {
      super(msg, cause);
    }
  }

  public static class NotFoundException extends ReplicationException {
    public NotFoundException(String msg) {
      super(msg);
    }

    public NotFoundException(String msg, Throwable cause) {
      super(msg, cause);
    }
  }

  /** Raised when a bounded backoff policy gives up with intents still unprocessed. */
  public static class RetriesExhaustedException extends ReplicationException {
    private final transient List<WriteIntent> remaining;
    private final int attempts;

    public RetriesExhaustedException(String msg, int attempts, List<WriteIntent> remaining) {
      super(msg);
      this.attempts = attempts;
      this.remaining = List.copyOf(remaining);
    }

    public int attempts() {
      return attempts;
    }

    public List<WriteIntent> remaining() {
      return remaining;
    }
  }
}
