/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */


package io.softenclave.channel.op;

/**
 * The enclave answered a request with an {@link Operation#ERROR} response.
 */
public final class RemoteOperationException extends Exception {
    private final Operation request;
    private final String error;

    public RemoteOperationException(Operation request, String error) {
        super(request.wireName() + " failed in enclave: " + error);
        this.request = request;
        this.error = error;
    }

    public Operation request() {
        return request;
    }

    public String error() {
        return error;
    }
}
