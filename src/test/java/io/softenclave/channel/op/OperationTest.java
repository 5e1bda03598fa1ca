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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;

import java.util.Arrays;

import org.testng.annotations.Test;

public class OperationTest {

    @Test
    public void shouldBuildVersionedAssociatedData() {
        assertThat(Operation.PING.aad()).isEqualTo("soft-enclave/op=ping/v1");
        assertThat(Operation.SIGN_TRANSACTION.aad()).isEqualTo("soft-enclave/op=sign-transaction/v1");
        assertThat(Operation.EXECUTE_RESULT.aad()).isEqualTo("soft-enclave/op=execute-result/v1");
    }

    @Test
    public void everyAssociatedDataShouldBeDistinct() {
        assertThat(Arrays.stream(Operation.values()).map(Operation::aad)).doesNotHaveDuplicates();
    }

    @Test
    public void requestsShouldMapToResponses() {
        for (var op : Operation.values()) {
            if (op.isRequest()) {
                assertThat(op.response().isRequest()).isFalse();
            } else {
                assertThatIllegalStateException().isThrownBy(op::response);
            }
        }
        assertThat(Operation.GET_METRICS.response()).isEqualTo(Operation.METRICS);
    }

    @Test
    public void shouldLookUpByWireName() {
        for (var op : Operation.values()) {
            assertThat(Operation.fromWireName(op.wireName())).contains(op);
        }
        assertThat(Operation.fromWireName("PING")).isEmpty();
        assertThat(Operation.fromWireName("shutdown")).isEmpty();
    }
}
