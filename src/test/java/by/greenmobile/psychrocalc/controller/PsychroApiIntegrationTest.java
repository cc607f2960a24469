package by.greenmobile.psychrocalc.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class PsychroApiIntegrationTest {

    @Autowired
    private MockMvc mvc;

    @Test
    void resolvesStateFromRelativeHumidity() throws Exception {
        mvc.perform(post("/api/states").contentType(MediaType.APPLICATION_JSON).content("""
                        {"state": {"dryBulb": 24.0, "pair": "RELATIVE_HUMIDITY", "value": 0.5}}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.humidityRatio").value(closeTo(0.0092985, 1e-6)))
                .andExpect(jsonPath("$.enthalpy").value(closeTo(47.8146, 1e-3)))
                .andExpect(jsonPath("$.wetBulb").value(closeTo(17.068, 1e-3)))
                .andExpect(jsonPath("$.pressure").value(101325.0));
    }

    @Test
    void wetBulbAboveDryBulbIsRejected() throws Exception {
        mvc.perform(post("/api/states").contentType(MediaType.APPLICATION_JSON).content("""
                        {"state": {"dryBulb": 20.0, "pair": "WET_BULB", "value": 25.0}}
                        """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_INPUT"));
    }

    @Test
    void curveWithStepIncludesBothEnds() throws Exception {
        mvc.perform(post("/api/curves").contentType(MediaType.APPLICATION_JSON).content("""
                        {"kind": "RELATIVE_HUMIDITY", "value": 0.5, "minDryBulb": 0, "maxDryBulb": 40, "step": 10}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.points", hasSize(5)))
                .andExpect(jsonPath("$.points[0].dryBulb").value(0.0))
                .andExpect(jsonPath("$.points[4].dryBulb").value(40.0));
    }

    @Test
    void curveRejectsSamplesAndStepTogether() throws Exception {
        mvc.perform(post("/api/curves").contentType(MediaType.APPLICATION_JSON).content("""
                        {"kind": "SATURATION", "minDryBulb": 0, "maxDryBulb": 40, "samples": 5, "step": 10}
                        """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void chartFamiliesAtAltitude() throws Exception {
        mvc.perform(get("/api/curves/chart").param("altitude", "1694"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].kind").value("SATURATION"))
                .andExpect(jsonPath("$[0].pressure").value(closeTo(82562.0, 5.0)));
    }

    @Test
    void coolingProcessLoads() throws Exception {
        mvc.perform(post("/api/processes").contentType(MediaType.APPLICATION_JSON).content("""
                        {"name": "Coil",
                         "entering": {"dryBulb": 24.0, "pair": "RELATIVE_HUMIDITY", "value": 0.5},
                         "leaving":  {"dryBulb": 14.0, "pair": "RELATIVE_HUMIDITY", "value": 0.95},
                         "massFlow": 1.0}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Coil"))
                .andExpect(jsonPath("$.totalHeat").value(closeTo(-9.8147, 1e-3)))
                .andExpect(jsonPath("$.sensibleHeat").value(closeTo(-10.2330, 1e-3)));
    }

    @Test
    void processNeedsExactlyOneFlow() throws Exception {
        mvc.perform(post("/api/processes").contentType(MediaType.APPLICATION_JSON).content("""
                        {"entering": {"dryBulb": 24.0, "pair": "RELATIVE_HUMIDITY", "value": 0.5},
                         "leaving":  {"dryBulb": 14.0, "pair": "RELATIVE_HUMIDITY", "value": 0.95}}
                        """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_INPUT"));
    }

    @Test
    void offCoilFromApproach() throws Exception {
        mvc.perform(post("/api/derive/off-coil").contentType(MediaType.APPLICATION_JSON).content("""
                        {"coilDewPoint": 11.0, "approach": 2.5}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dryBulb").value(13.5))
                .andExpect(jsonPath("$.dewPoint").value(11.0));
    }

    @Test
    void overDeterminedOffCoilIsRejected() throws Exception {
        mvc.perform(post("/api/derive/off-coil").contentType(MediaType.APPLICATION_JSON).content("""
                        {"coilDewPoint": 11.0, "approach": 2.0, "dryBulb": 15.0}
                        """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", startsWith("Over-determined")));
    }

    @Test
    void shrPairingReturnsProcessAtTarget() throws Exception {
        mvc.perform(post("/api/derive/shr").contentType(MediaType.APPLICATION_JSON).content("""
                        {"known": {"dryBulb": 24.0, "pair": "RELATIVE_HUMIDITY", "value": 0.5},
                         "knownSide": "ENTERING", "unknownDryBulb": 14.0, "targetSensibleHeatRatio": 0.8}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unknown.dryBulb").value(14.0))
                .andExpect(jsonPath("$.process.sensibleHeatRatio").value(closeTo(0.8, 1e-5)))
                .andExpect(jsonPath("$.process.massFlow").value(1.0));
    }

    @Test
    void locationsListsCatalog() throws Exception {
        mvc.perform(get("/api/locations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.LONDON.altitude").value(25.0))
                .andExpect(jsonPath("$.CUSTOM.location").value("Custom Location"));
    }

    @Test
    void designRun() throws Exception {
        mvc.perform(post("/api/design").contentType(MediaType.APPLICATION_JSON).content("""
                        {"location": "london"}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.location").value("LONDON"))
                .andExpect(jsonPath("$.processes", hasSize(6)))
                .andExpect(jsonPath("$.flows.crahVolumeFlow").value(closeTo(122.17, 0.01)))
                .andExpect(jsonPath("$.states['OC Dehum'].saturated").value(true));
    }

    @Test
    void designRejectsBlankLocation() throws Exception {
        mvc.perform(post("/api/design").contentType(MediaType.APPLICATION_JSON).content("{\"location\": \"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION"));
    }

    @Test
    void svgExport() throws Exception {
        mvc.perform(post("/export/svg").contentType(MediaType.APPLICATION_JSON).content("{\"location\": \"DUBAI\"}"))
                .andExpect(status().isOk())
                .andExpect(content().contentType("image/svg+xml"))
                .andExpect(header().string("Content-Disposition", containsString("chart_")))
                .andExpect(content().string(containsString("OAT Max N=20")));
    }

    @Test
    void pdfExport() throws Exception {
        mvc.perform(post("/export/pdf").contentType(MediaType.APPLICATION_JSON).content("{\"location\": \"FRANKFURT\"}"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_PDF))
                .andExpect(header().string("Content-Disposition", containsString("report_")));
    }
}
