package io.spectools.spectra.photometry;

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

import java.util.Objects;

/**
 * The passbands with reference transmission curves, and the file each curve is
 * stored in. File names follow the SVO Filter Profile Service convention.
 */
public enum PhotometricFilter {

    SDSS_U("u", "SLOAN_SDSS.u.dat"),
    SDSS_G("g", "SLOAN_SDSS.g.dat"),
    SDSS_R("r", "SLOAN_SDSS.r.dat"),
    SDSS_I("i", "SLOAN_SDSS.i.dat"),
    SDSS_Z("z", "SLOAN_SDSS.z.dat"),

    JOHNSON_U("U", "Generic_Johnson.U.dat"),
    JOHNSON_B("B", "Generic_Johnson.B.dat"),
    JOHNSON_V("V", "Generic_Johnson.V.dat"),
    JOHNSON_R("R", "Generic_Johnson.R.dat"),
    JOHNSON_I("I", "Generic_Johnson.I.dat"),

    GAIA_G("GaiaG", "GAIA_GAIA2r.G.dat"),
    GAIA_BP("GaiaBp", "GAIA_GAIA2r.Gbp.dat"),
    GAIA_RP("GaiaRp", "GAIA_GAIA2r.Grp.dat"),

    GALEX_FUV("GalexFUV", "GALEX_GALEX.FUV.dat"),
    GALEX_NUV("GalexNUV", "GALEX_GALEX.NUV.dat"),

    DENIS_I("DenisI", "DENIS_DENIS.I.dat"),

    TWOMASS_J("2mJ", "2MASS_2MASS.J.dat"),
    TWOMASS_H("2mH", "2MASS_2MASS.H.dat"),
    TWOMASS_K("2mK", "2MASS_2MASS.K.dat"),

    UKIDSS_Y("UKY", "UKIRT_UKIDSS.Y.dat"),
    UKIDSS_J("UKJ", "UKIRT_UKIDSS.J.dat"),
    UKIDSS_H("UKH", "UKIRT_UKIDSS.H.dat"),
    UKIDSS_K("UKK", "UKIRT_UKIDSS.K.dat"),

    WISE_W1("W1", "WISE_WISE.W1.dat"),
    WISE_W2("W2", "WISE_WISE.W2.dat"),

    SPITZER_I1("S1", "Spitzer_IRAC.I1.dat"),
    SPITZER_I2("S2", "Spitzer_IRAC.I2.dat");

    private final String id;
    private final String fileName;

    PhotometricFilter(String id, String fileName) {
        this.id = id;
        this.fileName = fileName;
    }

    /// @return the short identifier used by callers, e.g. {@code "g"} or {@code "2mK"}
    public String id() {
        return id;
    }

    public String fileName() {
        return fileName;
    }

    /**
     * Looks up a filter by identifier. Identifiers are case-sensitive: {@code "u"}
     * is SDSS, {@code "U"} is Johnson.
     *
     * @throws UnsupportedFilterException if no filter has the identifier
     */
    public static PhotometricFilter fromId(String id) {
        Objects.requireNonNull(id, "id cannot be null");
        for (PhotometricFilter filter : values()) {
            if (filter.id.equals(id)) {
                return filter;
            }
        }
        throw new UnsupportedFilterException(id);
    }
}
