package io.nosqlbench.command.commp;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonSerializer;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.commp.DataCidSize;
import io.nosqlbench.commp.cid.PieceCid;

/// JSON rendering of commitment results.
///
/// CIDs are written as IPLD links, `{"/": "baga6ea4se..."}`, and the result fields
/// use the capitalized names other Filecoin tooling reads.
public final class CommPJson {

    private CommPJson() {}

    /// gson instance with the CID link serializer registered
    public static final Gson gson = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .registerTypeAdapter(PieceCid.class, (JsonSerializer<PieceCid>) (cid, type, context) -> {
            JsonObject link = new JsonObject();
            link.addProperty("/", cid.toString());
            return link;
        })
        .create();

    /// Renders a result as indented JSON.
    /// @param result the result to render
    /// @return JSON with `PayloadSize`, `PieceSize` and `PieceCID`
    public static String toJson(DataCidSize result) {
        return gson.toJson(new Rendered(result));
    }

    private static final class Rendered {
        @SerializedName("PayloadSize")
        private final long payloadSize;
        @SerializedName("PieceSize")
        private final long pieceSize;
        @SerializedName("PieceCID")
        private final PieceCid pieceCid;

        private Rendered(DataCidSize result) {
            this.payloadSize = result.payloadSize();
            this.pieceSize = result.pieceSize();
            this.pieceCid = result.pieceCid();
        }
    }
}
