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


package io.softenclave.channel;

/**
 * Thrown when a peer public key is malformed, not on the curve or of low order, or when the agreement itself fails.
 */
public final class KeyAgreementException extends ChannelException {

    public KeyAgreementException(String message) {
        super(ErrorKind.KEY_AGREEMENT, message);
    }

    public KeyAgreementException(String message, Throwable cause) {
        super(ErrorKind.KEY_AGREEMENT, message, cause);
    }
}
