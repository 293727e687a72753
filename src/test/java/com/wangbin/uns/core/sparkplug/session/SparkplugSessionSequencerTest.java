package com.wangbin.uns.core.sparkplug.session;

import com.wangbin.uns.common.constant.SparkplugConstant;
import com.wangbin.uns.core.sparkplug.codec.SparkplugPayloadCodec;
import com.wangbin.uns.core.sparkplug.model.Metric;
import com.wangbin.uns.core.sparkplug.model.SparkplugDataType;
import com.wangbin.uns.core.sparkplug.model.SparkplugPayload;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SparkplugSessionSequencerTest {

    @Test
    void seqStartsAtZeroAndWrapsAfter255() {
        SparkplugSessionSequencer sequencer = new SparkplugSessionSequencer();
        int previous = sequencer.nextSeq();
        assertEquals(0, previous);

        for (int i = 0; i < 270; i++) {
            int next = sequencer.nextSeq();
            if (previous < 255) {
                assertEquals(previous + 1, next);
            } else {
                assertEquals(0, next);
            }
            previous = next;
        }
    }

    @Test
    void bdSeqIsIndependentOfSeq() {
        SparkplugSessionSequencer sequencer = new SparkplugSessionSequencer();
        for (int i = 0; i < 300; i++) {
            sequencer.nextSeq();
        }

        assertEquals(0, sequencer.nextBdSeq());
        assertEquals(1, sequencer.nextBdSeq());
    }

    @Test
    void deathPayloadCarriesBdSeqOnly() {
        SparkplugPayload payload = new SparkplugSessionSequencer(() -> 1234L).buildDeathPayload();

        assertEquals(1, payload.getMetrics().size());
        Metric metric = payload.getMetrics().get(0);
        assertEquals(SparkplugConstant.BD_SEQ_METRIC, metric.getName());
        assertEquals(SparkplugDataType.Int64, metric.getDataType());
        assertEquals(0L, metric.getValue().value());
        assertEquals(1234L, metric.getTimestamp());
    }

    @Test
    void birthAfterDeathAdvancesBdSeq() {
        SparkplugSessionSequencer sequencer = new SparkplugSessionSequencer();
        sequencer.buildDeathPayload();

        SparkplugPayload birth = sequencer.buildBirthPayload(
                Metric.of("Temp", SparkplugDataType.Double, 20.0, 1L));

        assertEquals(0L, birth.getSeq());
        Metric bdSeq = birth.getMetrics().get(0);
        assertEquals(SparkplugConstant.BD_SEQ_METRIC, bdSeq.getName());
        assertEquals(SparkplugDataType.Int64, bdSeq.getDataType());
        assertNotNull(bdSeq.getTimestamp());
        assertEquals(1L, bdSeq.getValue().value());
        assertEquals("Temp", birth.getMetrics().get(1).getName());
    }

    @Test
    void dataPayloadsContinueTheSequence() {
        SparkplugSessionSequencer sequencer = new SparkplugSessionSequencer();
        sequencer.buildBirthPayload();

        assertEquals(1L, sequencer.buildNodeDataPayload(List.of()).getSeq());
        assertEquals(2L, sequencer.buildDeviceBirthPayload(List.of()).getSeq());
        assertEquals(3L, sequencer.buildDeviceDataPayload(
                List.of(Metric.of("x", SparkplugDataType.Int32, 1, 1L))).getSeq());
    }

    @Test
    void deathPayloadEncodesBdSeqAsInt64() {
        byte[] bytes = SparkplugPayloadCodec.encode(new SparkplugSessionSequencer().buildDeathPayload());

        Metric metric = SparkplugPayloadCodec.decode(bytes).findMetric(SparkplugConstant.BD_SEQ_METRIC).orElseThrow();
        assertEquals(0L, metric.getValue().value());
        assertNull(SparkplugPayloadCodec.decode(bytes).getSeq());
    }
}
