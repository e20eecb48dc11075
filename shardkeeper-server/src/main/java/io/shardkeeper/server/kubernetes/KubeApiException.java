/*
 * Copyright 2021 Netflix, Inc.
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

package io.shardkeeper.server.kubernetes;

import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.V1Status;

public class KubeApiException extends RuntimeException {

    public enum ErrorCode {
        CONFLICT_ALREADY_EXISTS,
        CONFLICT,
        INTERNAL,
        NOT_FOUND,
    }

    private final ErrorCode errorCode;
    private final int httpStatus;

    public KubeApiException(String message, ErrorCode errorCode, int httpStatus) {
        super(message);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    public KubeApiException(String message, Throwable cause) {
        super(message, cause);
        if (cause instanceof ApiException) {
            ApiException apiException = (ApiException) cause;
            this.httpStatus = apiException.getCode();
            this.errorCode = toErrorCode(apiException.getCode(), apiException.getResponseBody());
        } else {
            this.httpStatus = 0;
            this.errorCode = ErrorCode.INTERNAL;
        }
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public boolean isNotFound() {
        return errorCode == ErrorCode.NOT_FOUND;
    }

    /**
     * Builds an exception from a failed API server response.
     */
    public static KubeApiException fromStatus(String operation, int httpStatus, V1Status status) {
        String reason = status == null ? null : status.getReason();
        String message = status == null ? null : status.getMessage();
        return new KubeApiException(
                String.format("%s failed: httpStatus=%s, reason=%s, message=%s", operation, httpStatus, reason, message),
                toErrorCode(httpStatus, reason),
                httpStatus
        );
    }

    private static ErrorCode toErrorCode(int httpStatus, String details) {
        if (httpStatus == 404) {
            return ErrorCode.NOT_FOUND;
        }
        if (httpStatus == 409) {
            return details != null && details.contains("AlreadyExists") ? ErrorCode.CONFLICT_ALREADY_EXISTS : ErrorCode.CONFLICT;
        }
        return ErrorCode.INTERNAL;
    }
}
