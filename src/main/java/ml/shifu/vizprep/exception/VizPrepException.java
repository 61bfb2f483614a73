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
package ml.shifu.vizprep.exception;

/**
 * VizPrepException, contains error code and the column and operation it happened on, so that callers can decide
 * whether to retry with a different choice.
 */
public class VizPrepException extends RuntimeException {

    /**
     * serialVersionUID
     */
    private static final long serialVersionUID = -2870937461127346025L;

    /**
     * error code
     */
    private VizPrepErrorCode error = null;

    /**
     * column the error is about, null if not column related
     */
    private String columnName;

    /**
     * operation which raised the error, like 'impute' or 'resolveVisualization'
     */
    private String operation;

    public VizPrepException(VizPrepErrorCode code) {
        super(code.getDescription());
        setError(code);
    }

    public VizPrepException(VizPrepErrorCode code, Exception e) {
        super(e);
        this.setError(code);
    }

    public VizPrepException(VizPrepErrorCode code, String msg) {
        super(msg);
        this.setError(code);
    }

    public VizPrepException(VizPrepErrorCode code, Exception e, String msg) {
        super(msg, e);
        this.setError(code);
    }

    public VizPrepException(VizPrepErrorCode code, String operation, String columnName, String msg) {
        super(msg);
        this.setError(code);
        this.operation = operation;
        this.columnName = columnName;
    }

    public VizPrepErrorCode getError() {
        return error;
    }

    public void setError(VizPrepErrorCode error) {
        this.error = error;
    }

    public String getColumnName() {
        return columnName;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public String toString() {
        return "VizPrepException [error=" + error + ", operation=" + operation + ", column=" + columnName
                + ", message=" + getMessage() + "]";
    }

}
