/**
 * Feature snapshot sources.
 */
package com.moodsentinel.core.source;
