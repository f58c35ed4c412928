/**
 * JSON parsing and rendering on top of Jackson's streaming API.
 */
package ca.gc.cra.bridge.application.json;
