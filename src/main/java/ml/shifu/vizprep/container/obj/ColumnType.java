/*
 * Copyright [2012-2014] PayPal Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.shifu.vizprep.container.obj;

/**
 * Native storage type of a column. C is for textual columns, N for integer or floating point columns.
 */
public enum ColumnType {
    N((byte) 1), C((byte) 2);

    /**
     * byte type for saving space
     */
    private final byte byteType;

    private ColumnType(byte byteType) {
        this.byteType = byteType;
    }

    public boolean isNumerical() {
        return byteType == N.getByteType();
    }

    public boolean isCategorical() {
        return byteType == C.getByteType();
    }

    public byte getByteType() {
        return byteType;
    }
}
