package com.questrail.homeshadow.protocol.isy.codec.impl;

import com.questrail.homeshadow.api.EntityAddress;
import com.questrail.homeshadow.api.NodeChangeAction;
import com.questrail.homeshadow.api.PropertyValue;
import com.questrail.homeshadow.api.SystemStatus;
import com.questrail.homeshadow.api.UnitOfMeasure;
import com.questrail.homeshadow.protocol.isy.codec.EventDecodeException;
import com.questrail.homeshadow.protocol.isy.internal.events.StreamEvent;
import com.questrail.homeshadow.protocol.isy.internal.events.StreamEvent.ProgramCondition;
import com.questrail.homeshadow.protocol.isy.internal.events.StreamEvent.ProgramRunState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultEventFrameDecoderTest
 * -----------------------------------------------------------------------------
 * Frame text to {@link StreamEvent} for each event category the client acts
 * on, plus the ignored and malformed cases.
 */
class DefaultEventFrameDecoderTest {

    private final DefaultEventFrameDecoder decoder = new DefaultEventFrameDecoder();

    private <T extends StreamEvent> T decodeAs(Class<T> type, String frame) {
        Optional<StreamEvent> event = decoder.decode(frame);
        assertTrue(event.isPresent(), "expected an event for " + frame);
        assertInstanceOf(type, event.get());
        return type.cast(event.get());
    }

    @Test
    void heartbeatCarriesSequenceAndInterval() {
        StreamEvent.Heartbeat hb = decodeAs(StreamEvent.Heartbeat.class,
                "<?xml version=\"1.0\"?><Event seqnum=\"12\" sid=\"uuid:47\">"
                        + "<control>_0</control><action>120</action><node></node><eventInfo></eventInfo></Event>");

        assertEquals(12, hb.sequence());
        assertEquals(Duration.ofSeconds(120), hb.interval());
    }

    @Test
    void statusWithUnitAndPrecision() {
        StreamEvent.PropertyUpdate update = decodeAs(StreamEvent.PropertyUpdate.class,
                "<Event seqnum=\"3\"><control>ST</control>"
                        + "<action uom=\"17\" prec=\"1\">725</action>"
                        + "<node>1A 2B 3C 1</node><fmtAct>72.5°F</fmtAct></Event>");

        assertEquals(EntityAddress.node("1A 2B 3C 1"), update.address());
        assertEquals("ST", update.key());
        PropertyValue value = update.value();
        assertEquals(725L, value.value().getAsLong());
        assertEquals(1, value.precision());
        assertEquals(UnitOfMeasure.of("17"), value.unit());
        assertEquals("72.5°F", value.formatted());
    }

    @Test
    void statusWithoutUnitIsNotSet() {
        StreamEvent.PropertyUpdate update = decodeAs(StreamEvent.PropertyUpdate.class,
                "<Event><control>ST</control><action>255</action><node>1A 2B 3C 1</node></Event>");

        assertEquals(UnitOfMeasure.NOT_SET, update.value().unit());
        assertEquals("", update.value().formatted());
    }

    @Test
    void emptyStatusIsUnknown() {
        StreamEvent.PropertyUpdate update = decodeAs(StreamEvent.PropertyUpdate.class,
                "<Event><control>ST</control><action uom=\"0\"></action><node>1A 2B 3C 1</node></Event>");

        assertFalse(update.value().isKnown());
        assertEquals(UnitOfMeasure.of("0"), update.value().unit());
    }

    @Test
    void controlWithAndWithoutValue() {
        StreamEvent.ControlMessage on = decodeAs(StreamEvent.ControlMessage.class,
                "<Event><control>DON</control><action></action><node>1A 2B 3C 1</node></Event>");
        assertEquals("DON", on.control());
        assertTrue(on.value().isEmpty());

        StreamEvent.ControlMessage ol = decodeAs(StreamEvent.ControlMessage.class,
                "<Event><control>OL</control><action>255</action><node>1A 2B 3C 1</node></Event>");
        assertEquals(255L, ol.value().orElseThrow().value().getAsLong());
    }

    @Test
    void programStatusReport() {
        StreamEvent.ProgramUpdate program = decodeAs(StreamEvent.ProgramUpdate.class,
                "<Event><control>_1</control><action>0</action><node></node>"
                        + "<eventInfo><id>1a</id><on/><rr/><s>21</s>"
                        + "<r>240115 07:30:00</r><f>240115 07:30:05</f></eventInfo></Event>");

        assertEquals(EntityAddress.program("001A"), program.address());
        assertEquals(Optional.of(true), program.enabled());
        assertEquals(Optional.of(true), program.runAtStartup());
        assertEquals(Optional.of(ProgramCondition.TRUE), program.condition());
        assertEquals(Optional.of(ProgramRunState.IDLE), program.runState());
        assertEquals(Optional.of(LocalDateTime.of(2024, 1, 15, 7, 30, 0)), program.lastRun());
        assertEquals(Optional.of(LocalDateTime.of(2024, 1, 15, 7, 30, 5)), program.lastFinish());
    }

    @Test
    void partialProgramReportLeavesFieldsAbsent() {
        StreamEvent.ProgramUpdate program = decodeAs(StreamEvent.ProgramUpdate.class,
                "<Event><control>_1</control><action>0</action>"
                        + "<eventInfo><id>0002</id><off/></eventInfo></Event>");

        assertEquals(Optional.of(false), program.enabled());
        assertTrue(program.runAtStartup().isEmpty());
        assertTrue(program.condition().isEmpty());
        assertTrue(program.lastRun().isEmpty());
    }

    @Test
    void variableValueAndInit() {
        StreamEvent.PropertyUpdate value = decodeAs(StreamEvent.PropertyUpdate.class,
                "<Event><control>_1</control><action>6</action><eventInfo>"
                        + "<var type=\"2\" id=\"7\"><val>42</val><ts>20240115 07:30:00</ts></var>"
                        + "</eventInfo></Event>");
        assertEquals(EntityAddress.variable(2, 7), value.address());
        assertEquals("ST", value.key());
        assertEquals(42L, value.value().value().getAsLong());

        StreamEvent.PropertyUpdate init = decodeAs(StreamEvent.PropertyUpdate.class,
                "<Event><control>_1</control><action>7</action><eventInfo>"
                        + "<var type=\"1\" id=\"3\"><init>5</init></var></eventInfo></Event>");
        assertEquals("init", init.key());
        assertEquals(5L, init.value().value().getAsLong());
    }

    @Test
    void otherTriggerActionsAreIgnored() {
        assertTrue(decoder.decode(
                "<Event><control>_1</control><action>3</action><eventInfo></eventInfo></Event>").isEmpty());
    }

    @Test
    void nodeRenamed() {
        StreamEvent.NodeListChanged change = decodeAs(StreamEvent.NodeListChanged.class,
                "<Event><control>_3</control><action>NN</action><node>1A 2B 3C 1</node>"
                        + "<eventInfo><newName>Pantry</newName></eventInfo></Event>");

        assertEquals(NodeChangeAction.NODE_RENAMED, change.action());
        assertEquals(EntityAddress.node("1A 2B 3C 1"), change.address());
        assertEquals("Pantry", change.info().get("newName"));
    }

    @Test
    void groupActionsAddressTheGroup() {
        StreamEvent.NodeListChanged change = decodeAs(StreamEvent.NodeListChanged.class,
                "<Event><control>_3</control><action>GR</action><node>12345</node><eventInfo/></Event>");

        assertEquals(EntityAddress.group("12345"), change.address());
        assertEquals(NodeChangeAction.GROUP_REMOVED, change.action());
    }

    @Test
    void unknownNodeChangeCodeIsIgnored() {
        assertTrue(decoder.decode(
                "<Event><control>_3</control><action>ZZ</action><node>1</node></Event>").isEmpty());
    }

    @Test
    void systemBusyStatus() {
        StreamEvent.SystemStatusChanged status = decodeAs(StreamEvent.SystemStatusChanged.class,
                "<Event><control>_5</control><action>1</action><node></node></Event>");

        assertEquals(SystemStatus.BUSY, status.status());
    }

    @Test
    void deviceMemoryProgress() {
        StreamEvent.NodeListChanged change = decodeAs(StreamEvent.NodeListChanged.class,
                "<Event><control>_7</control><action>1</action><node></node>"
                        + "<eventInfo>[  1A 2B 3C 1] Memory : Write dbAddr=0x0FF8 [A2] cmd1=0x2E cmd2=0x00"
                        + "</eventInfo></Event>");

        assertEquals(NodeChangeAction.DEVICE_MEMORY, change.action());
        assertEquals(EntityAddress.node("1A 2B 3C 1"), change.address());
    }

    @Test
    void subscriptionResponseIsAnAck() {
        StreamEvent.SubscriptionAck ack = decodeAs(StreamEvent.SubscriptionAck.class,
                "<s:Envelope><s:Body><SubscriptionResponse><SID>uuid:47</SID>"
                        + "<duration>0</duration></SubscriptionResponse></s:Body></s:Envelope>");

        assertEquals("uuid:47", ack.streamId());
    }

    @Test
    void unhandledCategoryIsIgnored() {
        assertTrue(decoder.decode("<Event><control>_4</control><action>0</action></Event>").isEmpty());
    }

    @Test
    void malformedXmlIsRejected() {
        assertThrows(EventDecodeException.class, () -> decoder.decode("<Event><control>ST</control>"));
    }

    @Test
    void doctypeIsRejected() {
        assertThrows(EventDecodeException.class, () -> decoder.decode(
                "<!DOCTYPE x [<!ENTITY e \"boom\">]><Event><control>&e;</control></Event>"));
    }

    @Test
    void missingControlOrNodeIsRejected() {
        assertThrows(EventDecodeException.class, () -> decoder.decode("<Event><action>1</action></Event>"));
        assertThrows(EventDecodeException.class,
                () -> decoder.decode("<Event><control>ST</control><action>1</action></Event>"));
        assertThrows(EventDecodeException.class, () -> decoder.decode("<Other/>"));
    }

    @Test
    void exponentValueIsExpandedToAnInteger() {
        StreamEvent.PropertyUpdate update = decodeAs(StreamEvent.PropertyUpdate.class,
                "<Event><control>ST</control><action>1.5E+3</action><node>1A 2B 3C 1</node></Event>");

        assertEquals(1500L, update.value().value().getAsLong());
        assertEquals(0, update.value().precision());
    }

    @Test
    void negativePrecisionIsRejected() {
        assertThrows(EventDecodeException.class, () -> decoder.decode(
                "<Event><control>ST</control><action prec=\"-1\">725</action><node>1A 2B 3C 1</node></Event>"));
        assertThrows(EventDecodeException.class, () -> decoder.decode(
                "<Event><control>_1</control><action>6</action><node></node><eventInfo>"
                        + "<var type=\"2\" id=\"3\"><val>5</val><prec>-2</prec></var></eventInfo></Event>"));
    }

    @Test
    void negativeHeartbeatIntervalIsRejected() {
        assertThrows(EventDecodeException.class, () -> decoder.decode(
                "<Event><control>_0</control><action>-30</action><node></node></Event>"));
    }

    @Test
    void nonNumericValueIsRejected() {
        assertThrows(EventDecodeException.class, () -> decoder.decode(
                "<Event><control>ST</control><action>abc</action><node>1</node></Event>"));
    }
}
