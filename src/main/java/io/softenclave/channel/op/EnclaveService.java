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

import io.softenclave.channel.op.OperationMessage.Execute;
import io.softenclave.channel.op.OperationMessage.ExecuteResult;
import io.softenclave.channel.op.OperationMessage.SignResult;
import io.softenclave.channel.op.OperationMessage.SignTransaction;

/**
 * The enclave-side engine that actually runs requests. Implementations are called on the transport's delivery thread
 * with already authenticated, decrypted requests. Any exception thrown is reported to the host as an
 * {@link Operation#ERROR} response carrying the exception message.
 */
public interface EnclaveService {

    ExecuteResult execute(Execute request) throws Exception;

    SignResult signTransaction(SignTransaction request) throws Exception;
}
