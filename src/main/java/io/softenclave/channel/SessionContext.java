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
 * The identities a session is bound to. Fields are always ordered by role: the initiator's (host's) endpoint first and
 * the responder's (enclave's) endpoint second, whichever side builds the context. Absent values are treated as the
 * empty string.
 *
 * @param initiatorEndpoint the host endpoint identifier, for example its origin.
 * @param responderEndpoint the enclave endpoint identifier.
 * @param codeIdentity a digest identifying the code the enclave runs.
 */
public record SessionContext(String initiatorEndpoint, String responderEndpoint, String codeIdentity) {

    public SessionContext {
        initiatorEndpoint = initiatorEndpoint == null ? "" : initiatorEndpoint;
        responderEndpoint = responderEndpoint == null ? "" : responderEndpoint;
        codeIdentity = codeIdentity == null ? "" : codeIdentity;
    }

    String canonicalString() {
        return initiatorEndpoint + "|" + responderEndpoint + "|" + codeIdentity;
    }
}
