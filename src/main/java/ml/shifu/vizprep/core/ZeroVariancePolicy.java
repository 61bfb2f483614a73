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
package ml.shifu.vizprep.core;

/**
 * What to do with a column whose standard deviation is zero or undefined when scaling.
 */
public enum ZeroVariancePolicy {
    /**
     * Raise ERROR_ZERO_VARIANCE.
     */
    FAIL,
    /**
     * Keep the column values unscaled.
     */
    PASS_THROUGH
}
