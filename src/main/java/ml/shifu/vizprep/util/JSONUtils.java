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
package ml.shifu.vizprep.util;

import java.io.IOException;
import java.io.Writer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerationException;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@link JSONUtils} is a unified entry for all json format serialization and de-serialization.
 * 
 * <p>
 * ObjectMapper instance is stored into ThreadLocal object to make sure thread safety.
 */
public class JSONUtils {

    private static final ThreadLocal<ObjectMapper> jsonMapper = new ThreadLocal<ObjectMapper>() {
        @Override
        protected ObjectMapper initialValue() {
            ObjectMapper mapper = new ObjectMapper();
            mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
            // writers passed in are owned by callers, like System.out
            mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
            return mapper;
        }
    };

    private static ObjectMapper getObjectMapperInstance() {
        return jsonMapper.get();
    }

    /*
     * @see ObjectMapper#readTree(String);
     */
    public static JsonNode readTree(String src) throws JsonProcessingException, IOException {
        return getObjectMapperInstance().readTree(src);
    }

    /*
     * @see ObjectWriter#writeValue(Writer, Object);
     */
    public static void writeValue(Writer w, Object value) throws JsonGenerationException, JsonMappingException,
            IOException {
        getObjectMapperInstance().writerWithDefaultPrettyPrinter().writeValue(w, value);
    }
}
